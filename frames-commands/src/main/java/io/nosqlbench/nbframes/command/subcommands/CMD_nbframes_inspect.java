/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.nbframes.command.subcommands;

import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.frame.FrameStatistics;
import io.nosqlbench.nbframes.io.hdf5.FrameFileSpec;
import io.nosqlbench.nbframes.io.hdf5.Hdf5FrameSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/// List the frame datasets of HDF5 files, or compare two files.
///
/// Files are given as `path[:group]`. Without a group, the root group is listed,
/// which is where `rebin` writes its output.
///
/// ## Usage
///
/// ```bash
/// nbframes inspect g4-rebinned.h5
/// nbframes inspect g4-rec.h5:/1 --stats
/// nbframes inspect a.h5 b.h5 --compare
/// ```
@CommandLine.Command(
    name = "inspect",
    header = "Show frame datasets of HDF5 files",
    description = "Lists frame datasets with their shapes and element types, optionally with "
        + "value statistics, or compares the frame datasets of two files.",
    exitCodeList = {
        "0: Success, or compared files match",
        "1: Error reading a file, or compared files differ",
        "2: Invalid options"
    }
)
public class CMD_nbframes_inspect implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_nbframes_inspect.class);

    @CommandLine.Parameters(
        arity = "1..*",
        description = "HDF5 files as path[:group] (group default: /)"
    )
    private List<String> files;

    @CommandLine.Option(
        names = {"--stats", "-s"},
        description = "Show min, max, mean, standard deviation and non-zero count per dataset"
    )
    private boolean stats = false;

    @CommandLine.Option(
        names = {"--compare", "-c"},
        description = "Compare the frame dataset names and shapes of exactly two files"
    )
    private boolean compare = false;

    @CommandLine.Option(
        names = {"--all", "-a"},
        description = "Include datasets whose names do not contain 'frame'"
    )
    private boolean all = false;

    @Override
    public Integer call() {
        if (compare && files.size() != 2) {
            System.err.println("Error: --compare needs exactly two files, got " + files.size());
            return 2;
        }
        List<FrameFileSpec> specs = new ArrayList<>();
        for (String file : files) {
            specs.add(toSpec(file));
        }
        try {
            if (compare) {
                return compare(specs.get(0), specs.get(1)) ? 0 : 1;
            }
            for (FrameFileSpec spec : specs) {
                describe(spec);
            }
            return 0;
        } catch (RuntimeException e) {
            logger.error("Error inspecting frame files", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static FrameFileSpec toSpec(String file) {
        if (file.indexOf(':') > 0) {
            return FrameFileSpec.parse(file);
        }
        return new FrameFileSpec(Path.of(file), "/");
    }

    private boolean selected(String name) {
        return all || name.toLowerCase(Locale.ROOT).contains("frame");
    }

    private void describe(FrameFileSpec spec) {
        try (Hdf5FrameSource source = Hdf5FrameSource.open(spec)) {
            List<String> names = source.names().stream().filter(this::selected).sorted().toList();
            System.out.printf("%s: %d datasets%n", spec, names.size());
            for (String name : names) {
                FrameShape shape = source.shape(name);
                System.out.printf("  %-48s %-14s %s%n", name, shape, source.elementType(name));
                if (stats) {
                    FrameStatistics s = FrameStatistics.of(name, source.readArray(name));
                    System.out.printf(
                        "    min=%.6g max=%.6g mean=%.6g std=%.6g sum=%.6g nonzero=%d/%d%n",
                        s.min(), s.max(), s.mean(), s.stddev(), s.sum(), s.nonZero(),
                        shape.cells());
                }
            }
        }
    }

    private boolean compare(FrameFileSpec left, FrameFileSpec right) {
        try (Hdf5FrameSource a = Hdf5FrameSource.open(left);
             Hdf5FrameSource b = Hdf5FrameSource.open(right))
        {
            TreeSet<String> namesA = new TreeSet<>(a.names().stream().filter(this::selected).toList());
            TreeSet<String> namesB = new TreeSet<>(b.names().stream().filter(this::selected).toList());
            boolean same = true;

            for (String name : namesA) {
                if (!namesB.contains(name)) {
                    System.out.printf("only in %s: %s%n", left, name);
                    same = false;
                }
            }
            for (String name : namesB) {
                if (!namesA.contains(name)) {
                    System.out.printf("only in %s: %s%n", right, name);
                    same = false;
                }
            }
            for (String name : namesA) {
                if (namesB.contains(name)) {
                    FrameShape shapeA = a.shape(name);
                    FrameShape shapeB = b.shape(name);
                    if (!shapeA.equals(shapeB)) {
                        System.out.printf("shape differs: %s %s vs %s%n", name, shapeA, shapeB);
                        same = false;
                    }
                }
            }
            System.out.println(same
                ? "files match: " + namesA.size() + " frame datasets with equal shapes"
                : "files differ");
            return same;
        }
    }
}

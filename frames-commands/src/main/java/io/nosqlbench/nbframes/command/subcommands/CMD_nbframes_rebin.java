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

import io.nosqlbench.nbframes.command.common.FrameFileOption;
import io.nosqlbench.nbframes.command.common.FrameNamingOption;
import io.nosqlbench.nbframes.command.common.LayoutOption;
import io.nosqlbench.nbframes.command.common.OutputFileOption;
import io.nosqlbench.nbframes.command.common.ParallelExecutionOption;
import io.nosqlbench.nbframes.command.common.RebinFactorsOption;
import io.nosqlbench.nbframes.command.common.VerbosityOption;
import io.nosqlbench.nbframes.io.hdf5.Hdf5FrameSink;
import io.nosqlbench.nbframes.io.hdf5.Hdf5FrameSource;
import io.nosqlbench.nbframes.rebin.FrameRebinner;
import io.nosqlbench.nbframes.rebin.RebinConfig;
import io.nosqlbench.nbframes.rebin.RebinSummary;
import io.nosqlbench.nbframes.reduce.RebinFactors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Rebin the frame datasets of one or more HDF5 files into a new HDF5 file.
///
/// Every dataset whose name contains `frame` is classified. Continuous frames are
/// block-summed per readout group and plane, label frames are ranked against their
/// charge frames. All outputs are written together, or not at all.
///
/// ## Usage
///
/// ```bash
/// nbframes rebin -i g4-rec.h5 -i g4-tru.h5
/// nbframes rebin -i g4-rec.h5:/1 -i g4-tru.h5:/1 -o out.h5 --rebin 4x2 --threads 4
/// ```
@CommandLine.Command(
    name = "rebin",
    header = "Rebin frame files per readout group and plane",
    description = "Reads the frame datasets of the input files, rebins them per readout group "
        + "and plane, and writes one HDF5 file with all rebinned arrays.",
    exitCodeList = {
        "0: Success",
        "1: Rebinning failed, no output written",
        "2: Invalid options"
    }
)
public class CMD_nbframes_rebin implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_nbframes_rebin.class);

    @CommandLine.Mixin
    private FrameFileOption frameFileOption = new FrameFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private RebinFactorsOption rebinFactorsOption = new RebinFactorsOption();

    @CommandLine.Mixin
    private LayoutOption layoutOption = new LayoutOption();

    @CommandLine.Mixin
    private FrameNamingOption frameNamingOption = new FrameNamingOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(
        names = {"--prefix"},
        description = "Prefix of every output dataset name (default: ${DEFAULT-VALUE})"
    )
    private String prefix = "frame_";

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            frameFileOption.validate();
            outputFileOption.validate();
            rebinFactorsOption.validate();
            layoutOption.validate();
            parallelExecutionOption.validate();
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
        verbosityOption.applyLogLevel();

        try {
            RebinFactors factors = rebinFactorsOption.getFactors();
            RebinConfig config = new RebinConfig(
                factors,
                layoutOption.getLayout(),
                frameNamingOption.getNaming(),
                frameNamingOption.getUnknownPolicy(),
                prefix,
                parallelExecutionOption.getThreadCount()
            );
            Path output = outputFileOption.getNormalizedOutputPath();
            logger.info("rebinning {} with {} blocks into {}",
                frameFileOption, factors, output);

            RebinSummary summary;
            try (Hdf5FrameSource source = new Hdf5FrameSource(frameFileOption.getInputs());
                 Hdf5FrameSink sink = new Hdf5FrameSink(output)
                     .attribute("rebin_channel", factors.channelFactor())
                     .attribute("rebin_time", factors.tickFactor())
                     .attribute("layout", layoutOption.toString()))
            {
                summary = new FrameRebinner(config).rebin(source, sink);
            }

            if (verbosityOption.showNormalOutput()) {
                printSummary(summary, output);
            }
            return 0;
        } catch (RuntimeException e) {
            logger.error("Rebinning failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(RebinSummary summary, Path output) {
        System.out.printf("Rebinned frames of shape %s with %s blocks%n",
            summary.inputShape(), summary.factors());
        System.out.printf("  Continuous:     %s%n", summary.continuousTypes());
        System.out.printf("  Label families: %s%n", summary.labelFamilies());
        if (!summary.skipped().isEmpty()) {
            System.out.printf("  Skipped:        %s%n", summary.skipped());
        }
        System.out.printf("Wrote %d datasets for %d planes to %s (%d ms)%n",
            summary.outputCount(), summary.units(), output, summary.elapsedMillis());
    }
}

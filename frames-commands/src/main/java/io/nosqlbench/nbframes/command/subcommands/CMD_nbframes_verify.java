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
import io.nosqlbench.nbframes.command.common.RebinFactorsOption;
import io.nosqlbench.nbframes.command.common.VerbosityOption;
import io.nosqlbench.nbframes.io.hdf5.Hdf5FrameSource;
import io.nosqlbench.nbframes.rebin.FrameVerifier;
import io.nosqlbench.nbframes.rebin.RebinConfig;
import io.nosqlbench.nbframes.rebin.VerificationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Check a rebinned file against the raw frames it was made from.
///
/// Continuous sums must be conserved per readout group and plane, and ranked
/// weights must be ordered. The rebin factors, layout, naming options and prefix
/// must match the ones the file was produced with.
///
/// ## Usage
///
/// ```bash
/// nbframes verify -i g4-rec.h5 -i g4-tru.h5 --rebinned g4-rebinned.h5
/// ```
@CommandLine.Command(
    name = "verify",
    header = "Verify a rebinned file against its raw frames",
    description = "Recomputes per-plane sums of the raw continuous frames and compares them "
        + "with the rebinned arrays, and checks the ordering of ranked weights.",
    exitCodeList = {
        "0: All checks passed",
        "1: A check failed, or a file could not be read",
        "2: Invalid options"
    }
)
public class CMD_nbframes_verify implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_nbframes_verify.class);

    @CommandLine.Mixin
    private FrameFileOption frameFileOption = new FrameFileOption();

    @CommandLine.Mixin
    private RebinFactorsOption rebinFactorsOption = new RebinFactorsOption();

    @CommandLine.Mixin
    private LayoutOption layoutOption = new LayoutOption();

    @CommandLine.Mixin
    private FrameNamingOption frameNamingOption = new FrameNamingOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(
        names = {"--rebinned"},
        required = true,
        description = "The rebinned HDF5 file as path[:group] (group default: /)"
    )
    private String rebinned;

    @CommandLine.Option(
        names = {"--prefix"},
        description = "Prefix of the rebinned dataset names (default: ${DEFAULT-VALUE})"
    )
    private String prefix = "frame_";

    @CommandLine.Option(
        names = {"--tolerance"},
        description = "Allowed relative difference between sums (default: ${DEFAULT-VALUE})"
    )
    private double tolerance = 1e-6;

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            frameFileOption.validate();
            rebinFactorsOption.validate();
            layoutOption.validate();
            if (!(tolerance >= 0.0d)) {
                throw new IllegalStateException("--tolerance must be non-negative");
            }
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
        verbosityOption.applyLogLevel();

        try {
            RebinConfig config = new RebinConfig(
                rebinFactorsOption.getFactors(),
                layoutOption.getLayout(),
                frameNamingOption.getNaming(),
                frameNamingOption.getUnknownPolicy(),
                prefix,
                1
            );
            VerificationReport report;
            try (Hdf5FrameSource raw = new Hdf5FrameSource(frameFileOption.getInputs());
                 Hdf5FrameSource out = Hdf5FrameSource.open(CMD_nbframes_inspect.toSpec(rebinned)))
            {
                report = new FrameVerifier(config, tolerance).verify(raw, out);
            }

            for (VerificationReport.Check check : report.failures()) {
                System.out.printf("FAIL %s: %s%n", check.outputName(), check.detail());
            }
            if (verbosityOption.isVerbose()) {
                for (VerificationReport.Check check : report.checks()) {
                    if (check.passed()) {
                        System.out.printf("ok   %s: %s%n", check.outputName(), check.detail());
                    }
                }
            }
            System.out.printf("%d of %d checks passed%n",
                report.checks().size() - report.failures().size(), report.checks().size());
            return report.passed() ? 0 : 1;
        } catch (RuntimeException e) {
            logger.error("Verification failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

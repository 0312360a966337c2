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

package io.nosqlbench.nbframes.command;

import io.nosqlbench.nbframes.command.subcommands.CMD_nbframes_inspect;
import io.nosqlbench.nbframes.command.subcommands.CMD_nbframes_locate;
import io.nosqlbench.nbframes.command.subcommands.CMD_nbframes_rebin;
import io.nosqlbench.nbframes.command.subcommands.CMD_nbframes_verify;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Detector Frame Rebinning Tool

 Reduces per-channel, per-tick detector readout frames into coarser frames, one
 set of arrays per readout group and wire plane.

 ## Subcommands
 - `rebin`: rebin the frame datasets of one or more HDF5 files into a new file
 - `inspect`: list frame datasets with shapes, types and optional statistics
 - `verify`: check a rebinned file against the raw frames it was made from
 - `locate`: map channel numbers to readout group, plane and local index

 # Basic Usage
 ```
 nbframes rebin -i g4-rec.h5 -i g4-tru.h5 -o g4-rebinned.h5 --rebin 2x4
 nbframes inspect g4-rebinned.h5 --stats
 nbframes verify -i g4-rec.h5 -i g4-tru.h5 --rebinned g4-rebinned.h5 --rebin 2x4
 nbframes locate 1500 4000
 ```
 */
@CommandLine.Command(name = "nbframes",
    header = "Rebin detector readout frames",
    description = "Reduces fine-grained channel x tick frames into coarser frames per readout "
        + "group and plane.\nUse subcommands to rebin, inspect and verify frame files.",
    mixinStandardHelpOptions = true,
    version = "nbframes 0.1.0",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: error", "2: usage error"},
    subcommands = {
        CMD_nbframes_rebin.class,
        CMD_nbframes_inspect.class,
        CMD_nbframes_verify.class,
        CMD_nbframes_locate.class,
        CommandLine.HelpCommand.class
    })
public class CMD_nbframes implements Callable<Integer> {

    /**
     * Create the nbframes command
     */
    public CMD_nbframes() {
    }

    /**
     * Create a command line for nbframes with the settings used by {@link #main(String[])}
     *
     * @return the configured command line
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_nbframes())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Run nbframes
     *
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}

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

package io.nosqlbench.nbframes.command.common;

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared rebinned output file option with force overwrite flag.
 */
public class OutputFileOption {

    /** File written when no output is given. */
    public static final String DEFAULT_OUTPUT = "g4-rebinned.h5";

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The rebinned HDF5 file to write (default: " + DEFAULT_OUTPUT + ")"
    )
    private Path outputPath = Path.of(DEFAULT_OUTPUT);

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /**
     * Gets the output file path.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Gets the normalized absolute output file path.
     */
    public Path getNormalizedOutputPath() {
        return outputPath.toAbsolutePath().normalize();
    }

    /**
     * Checks if force overwrite is enabled.
     */
    public boolean isForce() {
        return force;
    }

    /**
     * Validates the output file, checking for existence without force flag.
     *
     * @throws IllegalStateException if the file exists and --force was not given
     */
    public void validate() {
        if (Files.exists(outputPath) && !force) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
        if (Files.isDirectory(outputPath)) {
            throw new IllegalStateException("Output path is a directory: " + outputPath);
        }
    }

    @Override
    public String toString() {
        return force ? outputPath + " (force)" : outputPath.toString();
    }
}

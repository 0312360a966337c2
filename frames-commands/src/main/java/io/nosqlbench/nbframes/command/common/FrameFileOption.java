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

import io.nosqlbench.nbframes.io.hdf5.FrameFileSpec;
import picocli.CommandLine;

import java.nio.file.Files;
import java.util.List;

/**
 * Shared raw frame input option.
 * Each value names an HDF5 file and, optionally, the group holding its frames,
 * as {@code path[:group]}. The group defaults to {@value FrameFileSpec#DEFAULT_GROUP}.
 * <p>
 * Examples:
 * <ul>
 *   <li>{@code g4-rec.h5} - frames in group {@code /1}</li>
 *   <li>{@code g4-tru.h5:/2} - frames in group {@code /2}</li>
 *   <li>{@code merged.h5:/} - frames in the root group</li>
 * </ul>
 */
public class FrameFileOption {

    /**
     * Picocli type converter for {@link FrameFileSpec} values.
     */
    public static class FrameFileConverter implements CommandLine.ITypeConverter<FrameFileSpec> {

        @Override
        public FrameFileSpec convert(String value) {
            return FrameFileSpec.parse(value);
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "Raw frame file as path[:group], repeatable (group default: "
            + FrameFileSpec.DEFAULT_GROUP + ")",
        required = true,
        arity = "1..*",
        converter = FrameFileConverter.class
    )
    private List<FrameFileSpec> inputs;

    /**
     * Gets the input files in the order given.
     */
    public List<FrameFileSpec> getInputs() {
        return inputs;
    }

    /**
     * Validates that every input file exists.
     *
     * @throws IllegalStateException if a file is missing
     */
    public void validate() {
        for (FrameFileSpec input : inputs) {
            if (!Files.isRegularFile(input.path())) {
                throw new IllegalStateException("Input file does not exist: " + input.path());
            }
        }
    }

    @Override
    public String toString() {
        return String.valueOf(inputs);
    }
}

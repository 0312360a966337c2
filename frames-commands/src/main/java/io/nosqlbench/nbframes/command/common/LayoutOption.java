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

import io.nosqlbench.nbframes.geometry.DetectorLayout;
import io.nosqlbench.nbframes.geometry.LayoutConfig;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared detector layout option.
 * Without {@code --layout}, the built-in ProtoDUNE-VD layout is used.
 */
public class LayoutOption {

    @CommandLine.Option(
        names = {"--layout"},
        description = "YAML file declaring units, channels_per_unit, planes and halves "
            + "(default: built-in ProtoDUNE-VD layout)"
    )
    private Path layoutPath;

    /**
     * Gets the layout file, if one was given.
     */
    public Path getLayoutPath() {
        return layoutPath;
    }

    /**
     * Loads the selected layout.
     *
     * @return the layout from the given file, or the built-in one
     */
    public DetectorLayout getLayout() {
        if (layoutPath == null) {
            return DetectorLayout.protoDuneVd();
        }
        return LayoutConfig.file(layoutPath).toLayout();
    }

    /**
     * Validates that a given layout file exists.
     *
     * @throws IllegalStateException if the file is missing
     */
    public void validate() {
        if (layoutPath != null && !Files.isRegularFile(layoutPath)) {
            throw new IllegalStateException("Layout file does not exist: " + layoutPath);
        }
    }

    @Override
    public String toString() {
        return layoutPath == null ? "protodune-vd (built-in)" : layoutPath.toString();
    }
}

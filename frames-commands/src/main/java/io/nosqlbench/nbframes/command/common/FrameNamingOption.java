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

import io.nosqlbench.nbframes.classify.FrameNamingConvention;
import io.nosqlbench.nbframes.classify.UnknownFramePolicy;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared options that extend the default frame naming convention.
 */
public class FrameNamingOption {

    @CommandLine.Option(
        names = {"--continuous"},
        split = ",",
        description = "Additional frame types to sum as continuous frames"
    )
    private List<String> continuous = new ArrayList<>();

    @CommandLine.Option(
        names = {"--label-family"},
        split = ",",
        description = "Additional label families to rank against the charge frames"
    )
    private List<String> labelFamilies = new ArrayList<>();

    @CommandLine.Option(
        names = {"--ignore"},
        split = ",",
        description = "Frame types to leave out of the run"
    )
    private List<String> ignored = new ArrayList<>();

    @CommandLine.Option(
        names = {"--unknown-frames"},
        description = "What to do with frame datasets no naming rule matches: "
            + "${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private UnknownFramePolicy unknownPolicy = UnknownFramePolicy.fail;

    /**
     * Gets the default convention with the given additions applied.
     */
    public FrameNamingConvention getNaming() {
        return FrameNamingConvention.defaults()
            .withContinuous(continuous)
            .withLabelFamilies(labelFamilies)
            .withIgnored(ignored);
    }

    public UnknownFramePolicy getUnknownPolicy() {
        return unknownPolicy;
    }
}

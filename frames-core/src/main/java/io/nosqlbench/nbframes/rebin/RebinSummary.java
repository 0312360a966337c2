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

package io.nosqlbench.nbframes.rebin;

import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.reduce.RebinFactors;

import java.util.List;

/// What a completed rebin run produced.
/// @param factors the block shape used
/// @param inputShape the shared shape of the participating frames, null if none participated
/// @param continuousTypes the continuous frame types that were summed
/// @param labelFamilies the label families that were ranked
/// @param skipped frame datasets skipped under the unknown-frame policy
/// @param units the number of (group, plane) units processed
/// @param outputNames the committed output names, in registration order
/// @param elapsedMillis wall time of the run
public record RebinSummary(
    RebinFactors factors,
    FrameShape inputShape,
    List<String> continuousTypes,
    List<String> labelFamilies,
    List<String> skipped,
    int units,
    List<String> outputNames,
    long elapsedMillis
)
{

  public RebinSummary {
    continuousTypes = List.copyOf(continuousTypes);
    labelFamilies = List.copyOf(labelFamilies);
    skipped = List.copyOf(skipped);
    outputNames = List.copyOf(outputNames);
  }

  public int outputCount() {
    return outputNames.size();
  }
}

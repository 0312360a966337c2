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

import io.nosqlbench.nbframes.classify.FrameNamingConvention;
import io.nosqlbench.nbframes.classify.UnknownFramePolicy;
import io.nosqlbench.nbframes.geometry.DetectorLayout;
import io.nosqlbench.nbframes.reduce.RebinFactors;

/// Everything a [FrameRebinner] run depends on besides its source and sink.
/// @param factors the block shape
/// @param layout the channel geometry
/// @param naming how dataset names map to frame kinds
/// @param unknownPolicy what to do with frame datasets no convention matches
/// @param outputPrefix prepended to every output name
/// @param threads the number of (group, plane) units processed at once
public record RebinConfig(
    RebinFactors factors,
    DetectorLayout layout,
    FrameNamingConvention naming,
    UnknownFramePolicy unknownPolicy,
    String outputPrefix,
    int threads
)
{

  public RebinConfig {
    if (factors == null || layout == null || naming == null || unknownPolicy == null) {
      throw new IllegalArgumentException("factors, layout, naming and policy are required");
    }
    if (threads < 1) {
      throw new IllegalArgumentException("thread count must be positive, got " + threads);
    }
    outputPrefix = outputPrefix == null ? "" : outputPrefix;
  }

  /// 2x2 blocks over the ProtoDUNE-VD layout, default naming, failing on unknown
  /// frames, no output prefix, single threaded
  public static RebinConfig defaults() {
    return new RebinConfig(new RebinFactors(2, 2), DetectorLayout.protoDuneVd(),
        FrameNamingConvention.defaults(), UnknownFramePolicy.fail, "", 1);
  }

  public RebinConfig withFactors(RebinFactors factors) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  public RebinConfig withLayout(DetectorLayout layout) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  public RebinConfig withNaming(FrameNamingConvention naming) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  public RebinConfig withUnknownPolicy(UnknownFramePolicy unknownPolicy) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  public RebinConfig withOutputPrefix(String outputPrefix) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  public RebinConfig withThreads(int threads) {
    return new RebinConfig(factors, layout, naming, unknownPolicy, outputPrefix, threads);
  }

  /// @return the naming of output arrays
  public OutputNaming outputNaming() {
    return new OutputNaming(outputPrefix);
  }
}

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

package io.nosqlbench.nbframes.reduce;

import io.nosqlbench.nbframes.frame.FrameShape;

/// The block shape of a rebinning run.
/// @param channelFactor the number of source channels per output row
/// @param tickFactor the number of source ticks per output column
public record RebinFactors(int channelFactor, int tickFactor) {

  public RebinFactors {
    if (channelFactor < 1) {
      throw new IllegalArgumentException("channel rebin factor must be positive: " + channelFactor);
    }
    if (tickFactor < 1) {
      throw new IllegalArgumentException("tick rebin factor must be positive: " + tickFactor);
    }
  }

  /// @param factor the factor for both dimensions
  /// @return square rebin factors
  public static RebinFactors of(int factor) {
    return new RebinFactors(factor, factor);
  }

  /// the output shape for an input shape, counting trailing partial blocks
  /// @param input the input shape
  /// @return `(ceil(channels / channelFactor), ceil(ticks / tickFactor))`
  public FrameShape reducedShape(FrameShape input) {
    return new FrameShape(
        BlockGrid.blockCount(input.channels(), channelFactor),
        BlockGrid.blockCount(input.ticks(), tickFactor)
    );
  }

  @Override
  public String toString() {
    return channelFactor + "x" + tickFactor;
  }
}

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

package io.nosqlbench.nbframes.frame;

/// The (channels, ticks) shape of a frame or of a rebinned array.
///
/// @param channels the major dimension, one row per channel
/// @param ticks the minor dimension, one column per time tick
public record FrameShape(int channels, int ticks) {

  public FrameShape {
    if (channels < 0 || ticks < 0) {
      throw new IllegalArgumentException(
          "Frame dimensions must be non-negative: " + channels + "x" + ticks);
    }
  }

  /// @return the number of cells in this shape
  public long cells() {
    return (long) channels * ticks;
  }

  @Override
  public String toString() {
    return "(" + channels + ", " + ticks + ")";
  }
}

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

package io.nosqlbench.nbframes.geometry;

/// A half-open interval `[start, end)` of channel indices.
/// @param start the first channel, inclusive
/// @param end the last channel, exclusive
public record PlaneRange(int start, int end) {

  public PlaneRange {
    if (start < 0) {
      throw new LayoutException("Plane range start must be non-negative: " + start);
    }
    if (end <= start) {
      throw new LayoutException(
          "Plane range end must be greater than start: [" + start + ", " + end + ")");
    }
  }

  /// @return the number of channels in this range
  public int size() {
    return end - start;
  }

  /// @param channel a channel index
  /// @return true if the channel lies in this range
  public boolean contains(int channel) {
    return channel >= start && channel < end;
  }

  /// @param offset the amount to shift by
  /// @return this range shifted by offset
  public PlaneRange shift(int offset) {
    return new PlaneRange(start + offset, end + offset);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}

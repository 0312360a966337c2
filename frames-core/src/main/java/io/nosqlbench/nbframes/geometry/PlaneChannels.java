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

/// The ordered global channel indices owned by one (group, plane) pair.
///
/// The channel array is shared from the {@link ChannelMap} cache and must not be modified.
/// @param group the readout group id
/// @param plane the plane id
/// @param planeName the plane name
/// @param channels the ascending global channel indices
public record PlaneChannels(int group, int plane, String planeName, int[] channels) {

  /// @return the number of channels in this plane
  public int size() {
    return channels.length;
  }

  /// @return a short label like `group3/plane1(V)`
  public String label() {
    return "group" + group + "/plane" + plane + "(" + planeName + ")";
  }

  @Override
  public String toString() {
    return label() + "[" + channels.length + " channels]";
  }
}

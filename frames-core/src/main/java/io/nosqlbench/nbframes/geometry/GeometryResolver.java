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

import java.util.Arrays;
import java.util.Comparator;

/// Resolves global channel indices to their readout group, plane and local offset.
///
/// The unit-local ranges of the layout are flattened into one sorted boundary
/// table at construction, so each lookup is a division plus a binary search.
public class GeometryResolver {

  private final DetectorLayout layout;
  private final int[] starts;
  private final int[] halfOf;
  private final int[] planeOf;

  /// @param layout a validated layout
  public GeometryResolver(DetectorLayout layout) {
    this.layout = layout;
    int n = layout.halfCount() * layout.planeCount();
    Integer[] order = new Integer[n];
    for (int k = 0; k < n; k++) {
      order[k] = k;
    }
    int planes = layout.planeCount();
    Arrays.sort(order, Comparator.comparingInt(
        k -> layout.localRange(k / planes, k % planes).start()));
    this.starts = new int[n];
    this.halfOf = new int[n];
    this.planeOf = new int[n];
    for (int k = 0; k < n; k++) {
      halfOf[k] = order[k] / planes;
      planeOf[k] = order[k] % planes;
      starts[k] = layout.localRange(halfOf[k], planeOf[k]).start();
    }
  }

  /// @return the layout this resolver answers for
  public DetectorLayout layout() {
    return layout;
  }

  /// resolve one global channel index
  /// @param channel the global channel index
  /// @return the location of the channel
  /// @throws GeometryException if the channel is outside `[0, totalChannels)`
  public ChannelLocation resolve(int channel) {
    if (channel < 0 || channel >= layout.totalChannels()) {
      throw new GeometryException(channel, layout.totalChannels());
    }
    int unit = channel / layout.channelsPerUnit();
    int unitLocal = channel % layout.channelsPerUnit();

    int idx = Arrays.binarySearch(starts, unitLocal);
    if (idx < 0) {
      idx = -idx - 2;
    }
    int half = halfOf[idx];
    int plane = planeOf[idx];
    int group = unit * layout.halfCount() + half;
    return new ChannelLocation(group, plane, unitLocal - starts[idx]);
  }
}

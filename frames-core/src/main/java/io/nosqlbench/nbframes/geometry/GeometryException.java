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

import io.nosqlbench.nbframes.RebinException;

/// Thrown when a global channel index falls outside every range of a detector layout.
///
/// This never happens for input shaped to match the layout, so it signals a
/// configuration or logic fault rather than bad data.
public class GeometryException extends RebinException {

  private final int channel;
  private final int totalChannels;

  /// @param channel the unresolvable channel index
  /// @param totalChannels the number of channels the layout declares
  public GeometryException(int channel, int totalChannels) {
    super(String.format("channel %d is outside the declared layout of %d channels [0, %d)",
        channel, totalChannels, totalChannels));
    this.channel = channel;
    this.totalChannels = totalChannels;
  }

  /// @return the channel index which could not be resolved
  public int getChannel() {
    return channel;
  }

  /// @return the number of channels the layout declares
  public int getTotalChannels() {
    return totalChannels;
  }
}

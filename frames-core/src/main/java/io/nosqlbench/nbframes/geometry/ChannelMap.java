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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// The cached channel lists of every (group, plane) pair of a layout.
///
/// Built once per layout by resolving every channel index exactly once, then
/// shared read-only by all rebinning work units.
public final class ChannelMap {
  private static final Logger logger = LogManager.getLogger(ChannelMap.class);

  private final DetectorLayout layout;
  private final List<PlaneChannels> planes;

  private ChannelMap(DetectorLayout layout, List<PlaneChannels> planes) {
    this.layout = layout;
    this.planes = planes;
  }

  /// resolve every channel of the layout and group the results by (group, plane)
  /// @param layout the layout to map
  /// @return the channel map
  /// @throws LayoutException if some (group, plane) pair ends up without channels
  public static ChannelMap build(DetectorLayout layout) {
    GeometryResolver resolver = new GeometryResolver(layout);
    int groups = layout.groupCount();
    int planeCount = layout.planeCount();

    int[][] counts = new int[groups][planeCount];
    ChannelLocation[] locations = new ChannelLocation[layout.totalChannels()];
    for (int ch = 0; ch < locations.length; ch++) {
      ChannelLocation loc = resolver.resolve(ch);
      locations[ch] = loc;
      counts[loc.group()][loc.plane()]++;
    }

    int[][][] lists = new int[groups][planeCount][];
    for (int g = 0; g < groups; g++) {
      for (int p = 0; p < planeCount; p++) {
        if (counts[g][p] == 0) {
          throw new LayoutException("group " + g + " plane " + layout.planeName(p)
                                    + " resolves to no channels");
        }
        lists[g][p] = new int[counts[g][p]];
      }
    }
    for (int ch = 0; ch < locations.length; ch++) {
      ChannelLocation loc = locations[ch];
      lists[loc.group()][loc.plane()][loc.local()] = ch;
    }

    List<PlaneChannels> planes = new ArrayList<>(groups * planeCount);
    for (int g = 0; g < groups; g++) {
      for (int p = 0; p < planeCount; p++) {
        planes.add(new PlaneChannels(g, p, layout.planeName(p), lists[g][p]));
      }
    }
    logger.debug("built channel map for {} groups x {} planes over {} channels",
        groups, planeCount, layout.totalChannels());
    return new ChannelMap(layout, List.copyOf(planes));
  }

  /// @return the layout this map was built from
  public DetectorLayout layout() {
    return layout;
  }

  /// @return every (group, plane) pair, in group-major order
  public List<PlaneChannels> planes() {
    return planes;
  }

  /// @param group a readout group id
  /// @param plane a plane id
  /// @return the channels of that pair
  public PlaneChannels plane(int group, int plane) {
    if (group < 0 || group >= layout.groupCount() || plane < 0 || plane >= layout.planeCount()) {
      throw new IllegalArgumentException("no plane " + plane + " in group " + group);
    }
    return planes.get(group * layout.planeCount() + plane);
  }
}

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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/// The static channel geometry of a detector.
///
/// The global channel space is split into `units` top-level units of
/// `channelsPerUnit` channels each. Every unit is shared by a fixed number of
/// complementary halves, and each half owns one range of unit-local channels per
/// plane. A readout group is one half of one unit, numbered
/// `unit * halfCount + half`, so group ranges are the unit-local ranges shifted by
/// `unit * channelsPerUnit`.
///
/// ```
/// unit 0                                  unit 1
/// |U0  |U1  |V0  |V1  |W0    |W1    |     |U0  |U1  | ...
/// 0    476  952  1428 1904   2488  3072   3072 3548
/// ```
///
/// Instances are immutable and validated on construction: within a unit, the
/// ranges of all halves and planes must be pairwise disjoint and cover
/// `[0, channelsPerUnit)` exactly.
public final class DetectorLayout {

  private final int units;
  private final int channelsPerUnit;
  private final List<String> planeNames;
  private final List<List<PlaneRange>> halves;

  /// create and validate a layout
  /// @param units the number of top-level units
  /// @param channelsPerUnit the width of each unit in channels
  /// @param planeNames the plane names, in plane id order
  /// @param halves for each half, the unit-local range of each plane, in plane id order
  /// @throws LayoutException if the layout is inconsistent
  public DetectorLayout(
      int units,
      int channelsPerUnit,
      List<String> planeNames,
      List<List<PlaneRange>> halves
  )
  {
    if (units < 1) {
      throw new LayoutException("a layout needs at least one unit, got " + units);
    }
    if (channelsPerUnit < 1) {
      throw new LayoutException("channels per unit must be positive, got " + channelsPerUnit);
    }
    if ((long) units * channelsPerUnit > Integer.MAX_VALUE) {
      throw new LayoutException(
          "total channel count " + ((long) units * channelsPerUnit) + " exceeds the index space");
    }
    if (planeNames == null || planeNames.isEmpty()) {
      throw new LayoutException("a layout needs at least one plane");
    }
    if (new HashSet<>(planeNames).size() != planeNames.size()) {
      throw new LayoutException("plane names must be distinct: " + planeNames);
    }
    if (halves == null || halves.isEmpty()) {
      throw new LayoutException("a layout needs at least one half per unit");
    }
    List<List<PlaneRange>> copied = new ArrayList<>(halves.size());
    for (int h = 0; h < halves.size(); h++) {
      List<PlaneRange> ranges = halves.get(h);
      if (ranges == null || ranges.size() != planeNames.size()) {
        throw new LayoutException("half " + h + " declares "
                                  + (ranges == null ? 0 : ranges.size()) + " plane ranges, expected "
                                  + planeNames.size() + " for planes " + planeNames);
      }
      copied.add(List.copyOf(ranges));
    }
    this.units = units;
    this.channelsPerUnit = channelsPerUnit;
    this.planeNames = List.copyOf(planeNames);
    this.halves = List.copyOf(copied);
    validatePartition();
  }

  /// The ProtoDUNE vertical drift layout: four charge readout planes of 3072
  /// channels, each read out by two complementary CRUs with U, V and W planes.
  /// @return the layout, with 8 readout groups and 12288 channels
  public static DetectorLayout protoDuneVd() {
    return new DetectorLayout(
        4,
        3072,
        List.of("U", "V", "W"),
        List.of(
            List.of(new PlaneRange(0, 476), new PlaneRange(952, 1428), new PlaneRange(1904, 2488)),
            List.of(new PlaneRange(476, 952), new PlaneRange(1428, 1904), new PlaneRange(2488, 3072))
        )
    );
  }

  private void validatePartition() {
    record Entry(int half, int plane, PlaneRange range) {
    }
    List<Entry> entries = new ArrayList<>();
    for (int h = 0; h < halves.size(); h++) {
      for (int p = 0; p < planeNames.size(); p++) {
        entries.add(new Entry(h, p, halves.get(h).get(p)));
      }
    }
    entries.sort(Comparator.comparingInt(e -> e.range().start()));

    int expectedStart = 0;
    for (Entry e : entries) {
      PlaneRange r = e.range();
      if (r.start() < expectedStart) {
        throw new LayoutException(String.format(
            "range %s of half %d plane %s overlaps the preceding range ending at %d",
            r, e.half(), planeNames.get(e.plane()), expectedStart));
      }
      if (r.start() > expectedStart) {
        throw new LayoutException(String.format(
            "channels [%d, %d) are not covered by any plane; next range is %s of half %d plane %s",
            expectedStart, r.start(), r, e.half(), planeNames.get(e.plane())));
      }
      expectedStart = r.end();
    }
    if (expectedStart != channelsPerUnit) {
      throw new LayoutException(String.format(
          "plane ranges cover [0, %d) but a unit has %d channels", expectedStart, channelsPerUnit));
    }
  }

  /// @return the number of top-level units
  public int units() {
    return units;
  }

  /// @return the number of channels in each unit
  public int channelsPerUnit() {
    return channelsPerUnit;
  }

  /// @return the number of complementary halves sharing each unit
  public int halfCount() {
    return halves.size();
  }

  /// @return the number of planes per readout group
  public int planeCount() {
    return planeNames.size();
  }

  /// @return the plane names, in plane id order
  public List<String> planeNames() {
    return planeNames;
  }

  /// @param plane a plane id
  /// @return the plane name
  public String planeName(int plane) {
    return planeNames.get(plane);
  }

  /// @return the number of readout groups
  public int groupCount() {
    return units * halves.size();
  }

  /// @return the total number of channels covered by this layout
  public int totalChannels() {
    return units * channelsPerUnit;
  }

  /// @param half a half index
  /// @param plane a plane id
  /// @return the unit-local channel range
  public PlaneRange localRange(int half, int plane) {
    return halves.get(half).get(plane);
  }

  /// @param group a readout group id
  /// @param plane a plane id
  /// @return the global channel range owned by that group and plane
  public PlaneRange range(int group, int plane) {
    if (group < 0 || group >= groupCount()) {
      throw new IllegalArgumentException(
          "group " + group + " is outside [0, " + groupCount() + ")");
    }
    int unit = group / halves.size();
    int half = group % halves.size();
    return localRange(half, plane).shift(unit * channelsPerUnit);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("DetectorLayout{units=").append(units)
        .append(", channelsPerUnit=").append(channelsPerUnit)
        .append(", planes=").append(planeNames)
        .append(", halves=[");
    for (int h = 0; h < halves.size(); h++) {
      if (h > 0) {
        sb.append(", ");
      }
      sb.append(halves.get(h));
    }
    return sb.append("]}").toString();
  }
}

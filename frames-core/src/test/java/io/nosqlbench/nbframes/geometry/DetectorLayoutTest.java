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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DetectorLayout")
class DetectorLayoutTest {

  private final DetectorLayout vd = DetectorLayout.protoDuneVd();

  @Nested
  @DisplayName("ProtoDUNE-VD layout")
  class ProtoDuneVd {

    @Test
    void shouldDescribeEightGroupsOverFourUnits() {
      assertThat(vd.units()).isEqualTo(4);
      assertThat(vd.channelsPerUnit()).isEqualTo(3072);
      assertThat(vd.halfCount()).isEqualTo(2);
      assertThat(vd.groupCount()).isEqualTo(8);
      assertThat(vd.totalChannels()).isEqualTo(12288);
      assertThat(vd.planeNames()).containsExactly("U", "V", "W");
    }

    @Test
    void shouldOffsetGroupRangesByUnit() {
      assertThat(vd.range(0, 0)).isEqualTo(new PlaneRange(0, 476));
      assertThat(vd.range(1, 2)).isEqualTo(new PlaneRange(2488, 3072));
      assertThat(vd.range(2, 0)).isEqualTo(new PlaneRange(3072, 3548));
      assertThat(vd.range(7, 1)).isEqualTo(new PlaneRange(9216 + 1428, 9216 + 1904));
    }

    @ParameterizedTest(name = "channel {0} -> group {1} plane {2} local {3}")
    @CsvSource({
        "0, 0, 0, 0",
        "475, 0, 0, 475",
        "476, 1, 0, 0",
        "952, 0, 1, 0",
        "1428, 1, 1, 0",
        "2487, 0, 2, 583",
        "2488, 1, 2, 0",
        "3071, 1, 2, 583",
        "3072, 2, 0, 0",
        "12287, 7, 2, 583"
    })
    void shouldResolveChannels(int channel, int group, int plane, int local) {
      GeometryResolver resolver = new GeometryResolver(vd);
      assertThat(resolver.resolve(channel)).isEqualTo(new ChannelLocation(group, plane, local));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 12288, 100000})
    void shouldRejectChannelsOutsideTheLayout(int channel) {
      GeometryResolver resolver = new GeometryResolver(vd);
      assertThatThrownBy(() -> resolver.resolve(channel))
          .isInstanceOf(GeometryException.class)
          .hasMessageContaining("channel " + channel);
    }

    @Test
    void shouldMapEveryChannelToExactlyOnePlane() {
      ChannelMap map = ChannelMap.build(vd);
      assertThat(map.planes()).hasSize(24);

      boolean[] seen = new boolean[vd.totalChannels()];
      int total = 0;
      for (PlaneChannels plane : map.planes()) {
        int[] channels = plane.channels();
        assertThat(channels).isSorted();
        assertThat(channels.length).isEqualTo(vd.range(plane.group(), plane.plane()).size());
        for (int ch : channels) {
          assertThat(seen[ch]).as("channel %d seen twice", ch).isFalse();
          seen[ch] = true;
        }
        total += channels.length;
      }
      assertThat(total).isEqualTo(vd.totalChannels());
    }

    @Test
    void shouldListPlanesGroupMajor() {
      ChannelMap map = ChannelMap.build(vd);
      assertThat(map.planes().get(0).label()).isEqualTo("group0/plane0(U)");
      assertThat(map.planes().get(5).label()).isEqualTo("group1/plane2(W)");
      assertThat(map.plane(3, 1)).isSameAs(map.planes().get(10));
      assertThat(map.plane(3, 1).channels()[0]).isEqualTo(3072 + 1428);
    }
  }

  @Nested
  @DisplayName("validation")
  class Validation {

    @Test
    void shouldRejectOverlappingRanges() {
      assertThatThrownBy(() -> new DetectorLayout(1, 10, List.of("A"), List.of(
          List.of(new PlaneRange(0, 5)),
          List.of(new PlaneRange(4, 10)))))
          .isInstanceOf(LayoutException.class)
          .hasMessageContaining("overlaps");
    }

    @Test
    void shouldRejectGaps() {
      assertThatThrownBy(() -> new DetectorLayout(1, 10, List.of("A"), List.of(
          List.of(new PlaneRange(0, 4)),
          List.of(new PlaneRange(5, 10)))))
          .isInstanceOf(LayoutException.class)
          .hasMessageContaining("[4, 5) are not covered");
    }

    @Test
    void shouldRejectIncompleteCoverage() {
      assertThatThrownBy(() -> new DetectorLayout(1, 10, List.of("A"), List.of(
          List.of(new PlaneRange(0, 4)),
          List.of(new PlaneRange(4, 8)))))
          .isInstanceOf(LayoutException.class)
          .hasMessageContaining("cover [0, 8)");
    }

    @Test
    void shouldRejectMissingPlaneRanges() {
      assertThatThrownBy(() -> new DetectorLayout(1, 10, List.of("A", "B"), List.of(
          List.of(new PlaneRange(0, 10)))))
          .isInstanceOf(LayoutException.class)
          .hasMessageContaining("expected 2");
    }

    @Test
    void shouldRejectEmptyRanges() {
      assertThatThrownBy(() -> new PlaneRange(3, 3))
          .isInstanceOf(LayoutException.class);
    }

    @Test
    void shouldAcceptUnequalPlaneWidths() {
      DetectorLayout layout = new DetectorLayout(2, 6, List.of("A", "B"), List.of(
          List.of(new PlaneRange(0, 2), new PlaneRange(4, 5)),
          List.of(new PlaneRange(2, 4), new PlaneRange(5, 6))));
      assertThat(layout.groupCount()).isEqualTo(4);
      assertThat(new GeometryResolver(layout).resolve(10))
          .isEqualTo(new ChannelLocation(2, 1, 0));
    }

    @Test
    void shouldResolveLayoutsWithManyHalves() {
      int halfCount = 70_000;
      List<List<PlaneRange>> halves = new ArrayList<>(halfCount);
      for (int h = halfCount - 1; h >= 0; h--) {
        halves.add(List.of(new PlaneRange(h, h + 1)));
      }
      DetectorLayout layout = new DetectorLayout(2, halfCount, List.of("A"), halves);
      GeometryResolver resolver = new GeometryResolver(layout);

      assertThat(resolver.resolve(0)).isEqualTo(new ChannelLocation(halfCount - 1, 0, 0));
      assertThat(resolver.resolve(65_536)).isEqualTo(new ChannelLocation(3_463, 0, 0));
      assertThat(resolver.resolve(halfCount + 1))
          .isEqualTo(new ChannelLocation(halfCount + halfCount - 2, 0, 0));
    }
  }
}

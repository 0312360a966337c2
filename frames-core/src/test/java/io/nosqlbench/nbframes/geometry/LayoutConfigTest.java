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

import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayoutConfigTest {

  @Test
  public void testLayoutFileMatchesBuiltIn() throws URISyntaxException {
    Path path = Path.of(getClass().getResource("/layouts/protodune-vd.yaml").toURI());
    DetectorLayout layout = LayoutConfig.file(path).toLayout();
    DetectorLayout builtIn = DetectorLayout.protoDuneVd();

    assertThat(layout.totalChannels()).isEqualTo(builtIn.totalChannels());
    assertThat(layout.planeNames()).isEqualTo(builtIn.planeNames());
    for (int g = 0; g < builtIn.groupCount(); g++) {
      for (int p = 0; p < builtIn.planeCount(); p++) {
        assertThat(layout.range(g, p)).isEqualTo(builtIn.range(g, p));
      }
    }
  }

  @Test
  public void testInlineLayout() {
    LayoutConfig config = LayoutConfig.string("""
        units: 2
        channels_per_unit: 6
        planes: [A, B]
        halves:
          - {A: [0, 2], B: [4, 5]}
          - {A: [2, 4], B: [5, 6]}
        """);
    assertThat(config.getUnits()).isEqualTo(2);
    assertThat(config.getChannelsPerUnit()).isEqualTo(6);
    DetectorLayout layout = config.toLayout();
    assertThat(layout.groupCount()).isEqualTo(4);
    assertThat(layout.range(3, 0)).isEqualTo(new PlaneRange(8, 10));
  }

  @Test
  public void testMissingKey() {
    assertThatThrownBy(() -> LayoutConfig.string("units: 1\nplanes: [A]\n").toLayout())
        .isInstanceOf(LayoutException.class)
        .hasMessageContaining("channels_per_unit");
  }

  @Test
  public void testMalformedRange() {
    assertThatThrownBy(() -> LayoutConfig.string("""
        units: 1
        channels_per_unit: 4
        planes: [A]
        halves:
          - {A: [0]}
        """).toLayout())
        .isInstanceOf(LayoutException.class)
        .hasMessageContaining("[start, end) pair");
  }

  @Test
  public void testMissingFile() {
    assertThatThrownBy(() -> LayoutConfig.file(Path.of("does-not-exist.yaml")))
        .isInstanceOf(LayoutException.class)
        .hasMessageContaining("does-not-exist.yaml");
  }
}

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

package io.nosqlbench.nbframes.rebin;

import io.nosqlbench.nbframes.geometry.DetectorLayout;
import io.nosqlbench.nbframes.geometry.PlaneRange;
import io.nosqlbench.nbframes.io.InMemoryFrameStore;

import java.util.List;
import java.util.Random;

/// Small frame sets over a 12 channel layout, for rebinner and verifier tests.
final class RebinFixtures {

  static final int TICKS = 9;

  private RebinFixtures() {
  }

  /// two units of six channels, halves with unequal plane widths, four groups
  static DetectorLayout smallLayout() {
    return new DetectorLayout(2, 6, List.of("A", "B"), List.of(
        List.of(new PlaneRange(0, 2), new PlaneRange(4, 5)),
        List.of(new PlaneRange(2, 4), new PlaneRange(5, 6))));
  }

  static RebinConfig smallConfig() {
    return RebinConfig.defaults().withLayout(smallLayout());
  }

  static InMemoryFrameStore store(long seed) {
    Random random = new Random(seed);
    int channels = smallLayout().totalChannels();
    double[][] gauss = new double[channels][TICKS];
    double[][] charge1 = new double[channels][TICKS];
    double[][] charge2 = new double[channels][TICKS];
    int[][] track1 = new int[channels][TICKS];
    int[][] track2 = new int[channels][TICKS];
    for (int r = 0; r < channels; r++) {
      for (int c = 0; c < TICKS; c++) {
        gauss[r][c] = random.nextGaussian();
        charge1[r][c] = random.nextInt(4);
        charge2[r][c] = random.nextInt(3);
        track1[r][c] = random.nextInt(4);
        track2[r][c] = random.nextInt(4);
      }
    }
    return new InMemoryFrameStore()
        .add("frame_gauss", gauss)
        .add("frame_charge_1st", charge1)
        .add("frame_charge_2nd", charge2)
        .add("frame_orig_trackid_1st", track1)
        .add("frame_orig_trackid_2nd", track2)
        .add("channels", new int[][]{{0}});
  }
}

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

package io.nosqlbench.nbframes.reduce;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RankAggregator")
class RankAggregatorTest {

  private static final int A = 7;
  private static final int B = 3;

  @Test
  @DisplayName("sums weights per label before ranking")
  void shouldSumWeightsPerLabel() {
    LabelLayer layer = new LabelLayer(
        new int[][]{{A, A, B}},
        new double[][]{{5, 3, 4}});
    RankedBlocks ranked = RankAggregator.aggregate(layer, new RebinFactors(1, 3));

    assertThat(ranked.label1st()[0][0]).isEqualTo(A);
    assertThat(ranked.weight1st()[0][0]).isEqualTo(8.0d);
    assertThat(ranked.label2nd()[0][0]).isEqualTo(B);
    assertThat(ranked.weight2nd()[0][0]).isEqualTo(4.0d);
  }

  @Test
  @DisplayName("an empty block ranks nothing")
  void shouldZeroEmptyBlocks() {
    LabelLayer layer = new LabelLayer(
        new int[][]{{0, 0}, {5, 0}},
        new double[][]{{9, 9}, {0, 2}});
    RankedBlocks ranked = RankAggregator.aggregate(layer, new RebinFactors(2, 2));

    assertThat(ranked.label1st()[0][0]).isZero();
    assertThat(ranked.weight1st()[0][0]).isZero();
    assertThat(ranked.label2nd()[0][0]).isZero();
    assertThat(ranked.weight2nd()[0][0]).isZero();
  }

  @Test
  @DisplayName("maximal factors rank the whole slice as one block")
  void shouldRankWholeSliceWithMaximalFactors() {
    LabelLayer layer = new LabelLayer(
        new int[][]{{A, B, A}, {B, B, 0}},
        new double[][]{{1, 2, 1}, {1, 1, 9}});
    RankedBlocks ranked =
        RankAggregator.aggregate(layer, new RebinFactors(Integer.MAX_VALUE, Integer.MAX_VALUE));

    assertThat(ranked.label1st()).isDeepEqualTo(new int[][]{{B}});
    assertThat(ranked.weight1st()).isDeepEqualTo(new double[][]{{4}});
    assertThat(ranked.label2nd()).isDeepEqualTo(new int[][]{{A}});
    assertThat(ranked.weight2nd()).isDeepEqualTo(new double[][]{{2}});

    RankedBlocks perRow = RankAggregator.aggregate(layer, new RebinFactors(1, Integer.MAX_VALUE));
    assertThat(perRow.label1st()).isDeepEqualTo(new int[][]{{B}, {B}});
    assertThat(perRow.weight1st()).isDeepEqualTo(new double[][]{{2}, {2}});
  }

  @Test
  @DisplayName("a single label leaves the second rank empty")
  void shouldLeaveSecondRankEmpty() {
    LabelLayer layer = new LabelLayer(
        new int[][]{{4, 4}},
        new double[][]{{1, 2}});
    RankedBlocks ranked = RankAggregator.aggregate(layer, new RebinFactors(1, 2));

    assertThat(ranked.label1st()[0][0]).isEqualTo(4);
    assertThat(ranked.weight1st()[0][0]).isEqualTo(3.0d);
    assertThat(ranked.label2nd()[0][0]).isZero();
    assertThat(ranked.weight2nd()[0][0]).isZero();
  }

  @Test
  @DisplayName("equal sums rank the smaller label first, regardless of cell order")
  void shouldBreakTiesBySmallerLabel() {
    RankedBlocks forward = RankAggregator.aggregate(
        new LabelLayer(new int[][]{{9, 2}}, new double[][]{{1.5, 1.5}}), new RebinFactors(1, 2));
    RankedBlocks reverse = RankAggregator.aggregate(
        new LabelLayer(new int[][]{{2, 9}}, new double[][]{{1.5, 1.5}}), new RebinFactors(1, 2));

    assertThat(forward.label1st()[0][0]).isEqualTo(2);
    assertThat(forward.label2nd()[0][0]).isEqualTo(9);
    assertThat(reverse.label1st()).isDeepEqualTo(forward.label1st());
    assertThat(reverse.label2nd()).isDeepEqualTo(forward.label2nd());
  }

  @Test
  @DisplayName("non-positive weights do not contribute")
  void shouldSkipNonPositiveWeights() {
    LabelLayer layer = new LabelLayer(
        new int[][]{{1, 2, 2}},
        new double[][]{{-4, 0, 0.25}});
    RankedBlocks ranked = RankAggregator.aggregate(layer, new RebinFactors(1, 3));

    assertThat(ranked.label1st()[0][0]).isEqualTo(2);
    assertThat(ranked.weight1st()[0][0]).isEqualTo(0.25d);
    assertThat(ranked.label2nd()[0][0]).isZero();
  }

  @Test
  @DisplayName("contribution layers of one family are ranked together")
  void shouldRankLayersTogether() {
    LabelLayer first = new LabelLayer(new int[][]{{A, B}}, new double[][]{{2, 5}});
    LabelLayer second = new LabelLayer(new int[][]{{A, A}}, new double[][]{{2, 2}});
    RankedBlocks ranked = RankAggregator.aggregate(List.of(first, second), new RebinFactors(1, 2));

    assertThat(ranked.label1st()[0][0]).isEqualTo(A);
    assertThat(ranked.weight1st()[0][0]).isEqualTo(6.0d);
    assertThat(ranked.label2nd()[0][0]).isEqualTo(B);
    assertThat(ranked.weight2nd()[0][0]).isEqualTo(5.0d);
  }

  @Test
  @DisplayName("ranked weights are ordered in every cell")
  void shouldOrderWeightsEverywhere() {
    Random random = new Random(7);
    int[][] labels = new int[20][50];
    double[][] weights = new double[20][50];
    for (int r = 0; r < 20; r++) {
      for (int c = 0; c < 50; c++) {
        labels[r][c] = random.nextInt(5);
        weights[r][c] = random.nextDouble() * 10 - 2;
      }
    }
    RankedBlocks ranked =
        RankAggregator.aggregate(new LabelLayer(labels, weights), new RebinFactors(3, 7));

    assertThat(ranked.weight1st()).hasNumberOfRows(7);
    for (int r = 0; r < ranked.weight1st().length; r++) {
      assertThat(ranked.weight1st()[r]).hasSize(8);
      for (int c = 0; c < ranked.weight1st()[r].length; c++) {
        assertThat(ranked.weight1st()[r][c]).isGreaterThanOrEqualTo(ranked.weight2nd()[r][c]);
        assertThat(ranked.weight2nd()[r][c]).isGreaterThanOrEqualTo(0.0d);
        if (ranked.label2nd()[r][c] != 0) {
          assertThat(ranked.label2nd()[r][c]).isNotEqualTo(ranked.label1st()[r][c]);
        }
      }
    }
  }

  @Test
  void shouldRejectMismatchedSlices() {
    assertThatThrownBy(() -> new LabelLayer(new int[][]{{1, 2}}, new double[][]{{1}}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("differ in shape");
  }
}

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

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BlockReducerTest {

  @Test
  public void testEvenBlocks() {
    double[][] rows = {
        {1, 2, 3, 4},
        {5, 6, 7, 8}
    };
    double[][] out = BlockReducer.sum(rows, new RebinFactors(2, 2));
    assertThat(out).isDeepEqualTo(new double[][]{{14, 22}});
  }

  @Test
  public void testPartialEdgeBlocksAreNotPadded() {
    double[][] rows = {
        {1, 1, 1},
        {1, 1, 1},
        {1, 1, 1}
    };
    double[][] out = BlockReducer.sum(rows, new RebinFactors(2, 2));
    assertThat(out).isDeepEqualTo(new double[][]{
        {4, 2},
        {2, 1}
    });
  }

  @Test
  public void testNegativeValuesPassThrough() {
    double[][] rows = {{-3, 1}, {0.5, -0.5}};
    double[][] out = BlockReducer.sum(rows, new RebinFactors(2, 2));
    assertThat(out[0][0]).isEqualTo(-2.0d);
  }

  @Test
  public void testIdentityFactorsReproduceInput() {
    double[][] rows = {
        {1.5, 2.25, 3},
        {4, 5.125, 6}
    };
    assertThat(BlockReducer.sum(rows, new RebinFactors(1, 1))).isDeepEqualTo(rows);
  }

  @Test
  public void testFactorsLargerThanTheSlice() {
    double[][] rows = {{1, 2}, {3, 4}};
    assertThat(BlockReducer.sum(rows, new RebinFactors(10, 10)))
        .isDeepEqualTo(new double[][]{{10}});
  }

  @Test
  public void testMaximalFactorsCoverTheWholeSlice() {
    double[][] rows = {{1, 2}, {3, 4}, {5, 6}};
    assertThat(BlockReducer.sum(rows, new RebinFactors(Integer.MAX_VALUE, 1)))
        .isDeepEqualTo(new double[][]{{9, 12}});
    assertThat(BlockReducer.sum(rows, new RebinFactors(2, Integer.MAX_VALUE)))
        .isDeepEqualTo(new double[][]{{10}, {11}});
    assertThat(BlockGrid.blockCount(Integer.MAX_VALUE, Integer.MAX_VALUE)).isEqualTo(1);
    assertThat(BlockGrid.blockCount(0, Integer.MAX_VALUE)).isZero();
  }

  @Test
  public void testSumIsConserved() {
    Random random = new Random(42);
    double[][] rows = new double[37][101];
    double total = 0.0d;
    for (double[] row : rows) {
      for (int c = 0; c < row.length; c++) {
        row[c] = random.nextGaussian() * 100;
        total += row[c];
      }
    }
    double[][] out = BlockReducer.sum(rows, new RebinFactors(4, 10));
    assertThat(out.length).isEqualTo(10);
    assertThat(out[0].length).isEqualTo(11);
    double reduced = 0.0d;
    for (double[] row : out) {
      for (double v : row) {
        reduced += v;
      }
    }
    assertThat(reduced).isCloseTo(total, within(1e-6));
  }

  @Test
  public void testInputIsNotModified() {
    double[][] rows = {{1, 2}, {3, 4}};
    BlockReducer.sum(rows, new RebinFactors(2, 1));
    assertThat(rows).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
  }

  @Test
  public void testFactorsMustBePositive() {
    assertThatThrownBy(() -> new RebinFactors(0, 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("channel rebin factor");
    assertThatThrownBy(() -> new RebinFactors(2, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tick rebin factor");
  }
}

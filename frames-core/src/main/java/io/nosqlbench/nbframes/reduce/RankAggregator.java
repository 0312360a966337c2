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

import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.frame.LabelFrame;

import java.util.List;

/// Ranks the entities contributing to each block of a categorical plane slice.
///
/// For every block, all (label, weight) cell pairs of all given layers are
/// collected. Pairs with label 0 or a weight that is not strictly positive are
/// dropped. Weights are summed per distinct label, and the two labels with the
/// largest sums become the 1st and 2nd entries. Equal sums are broken in favor of
/// the smaller label id, so results never depend on cell order.
///
/// Each call keeps its own accumulation state, so independent label families can
/// be ranked concurrently.
public final class RankAggregator {

  private RankAggregator() {
  }

  /// rank a single label slice against its weight slice
  /// @param layer the label and weight slices
  /// @param factors the block shape
  /// @return the ranked blocks
  public static RankedBlocks aggregate(LabelLayer layer, RebinFactors factors) {
    return aggregate(List.of(layer), factors);
  }

  /// rank several contribution layers of one label family together
  /// @param layers the layers, all of one shape
  /// @param factors the block shape
  /// @return the ranked blocks
  public static RankedBlocks aggregate(List<LabelLayer> layers, RebinFactors factors) {
    if (layers.isEmpty()) {
      throw new IllegalArgumentException("at least one label layer is required");
    }
    FrameShape shape = layers.get(0).shape();
    for (LabelLayer layer : layers) {
      if (!layer.shape().equals(shape)) {
        throw new IllegalArgumentException(
            "label layers differ in shape: " + shape + " and " + layer.shape());
      }
    }
    BlockGrid grid = new BlockGrid(shape.channels(), shape.ticks(), factors);
    int rows = grid.blockRows();
    int cols = grid.blockCols();
    int[][] label1st = new int[rows][cols];
    double[][] weight1st = new double[rows][cols];
    int[][] label2nd = new int[rows][cols];
    double[][] weight2nd = new double[rows][cols];

    int blockCells = Math.min(factors.channelFactor(), shape.channels())
                     * Math.min(factors.tickFactor(), shape.ticks());
    Tally tally = new Tally(Math.max(1, blockCells) * layers.size());
    for (int br = 0; br < rows; br++) {
      for (int bc = 0; bc < cols; bc++) {
        tally.reset();
        for (int r = grid.rowStart(br); r < grid.rowEnd(br); r++) {
          for (int c = grid.colStart(bc); c < grid.colEnd(bc); c++) {
            for (LabelLayer layer : layers) {
              tally.add(layer.labels()[r][c], layer.weights()[r][c]);
            }
          }
        }
        tally.rank();
        label1st[br][bc] = tally.firstLabel;
        weight1st[br][bc] = tally.firstWeight;
        label2nd[br][bc] = tally.secondLabel;
        weight2nd[br][bc] = tally.secondWeight;
      }
    }
    return new RankedBlocks(label1st, weight1st, label2nd, weight2nd);
  }

  /// Per-block weight sums by distinct label, found by linear scan.
  private static final class Tally {
    private final int[] labels;
    private final double[] sums;
    private int size;

    int firstLabel;
    double firstWeight;
    int secondLabel;
    double secondWeight;

    Tally(int capacity) {
      this.labels = new int[capacity];
      this.sums = new double[capacity];
    }

    void reset() {
      size = 0;
    }

    void add(int label, double weight) {
      if (label == LabelFrame.NO_ENTITY || !(weight > 0.0d)) {
        return;
      }
      for (int i = 0; i < size; i++) {
        if (labels[i] == label) {
          sums[i] += weight;
          return;
        }
      }
      labels[size] = label;
      sums[size] = weight;
      size++;
    }

    void rank() {
      firstLabel = LabelFrame.NO_ENTITY;
      firstWeight = 0.0d;
      secondLabel = LabelFrame.NO_ENTITY;
      secondWeight = 0.0d;
      for (int i = 0; i < size; i++) {
        int label = labels[i];
        double sum = sums[i];
        if (firstLabel == LabelFrame.NO_ENTITY || outranks(label, sum, firstLabel, firstWeight)) {
          secondLabel = firstLabel;
          secondWeight = firstWeight;
          firstLabel = label;
          firstWeight = sum;
        } else if (secondLabel == LabelFrame.NO_ENTITY
                   || outranks(label, sum, secondLabel, secondWeight))
        {
          secondLabel = label;
          secondWeight = sum;
        }
      }
    }

    private static boolean outranks(int label, double sum, int otherLabel, double otherSum) {
      return sum > otherSum || (sum == otherSum && label < otherLabel);
    }
  }
}

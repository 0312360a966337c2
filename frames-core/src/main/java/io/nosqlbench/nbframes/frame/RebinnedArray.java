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

package io.nosqlbench.nbframes.frame;

/// One named output array of a rebinning run.
///
/// The payload is either a `double[][]` (summed magnitudes and ranked weights) or an
/// `int[][]` (ranked labels), so that it can be handed to an array store as is.
/// @param name the output dataset name
/// @param data the two-dimensional payload
/// @param shape the shape of the payload
public record RebinnedArray(String name, Object data, FrameShape shape) {

  public RebinnedArray {
    if (!(data instanceof double[][]) && !(data instanceof int[][])) {
      throw new IllegalArgumentException("rebinned array '" + name
                                         + "' must be double[][] or int[][], not "
                                         + (data == null ? "null" : data.getClass().getSimpleName()));
    }
  }

  /// wrap summed or weight values
  /// @param name the output dataset name
  /// @param values the values
  /// @return a rebinned array
  public static RebinnedArray ofDoubles(String name, double[][] values) {
    return new RebinnedArray(name, values, FrameArrays.shapeOf(values, name));
  }

  /// wrap label values
  /// @param name the output dataset name
  /// @param labels the labels
  /// @return a rebinned array
  public static RebinnedArray ofInts(String name, int[][] labels) {
    return new RebinnedArray(name, labels, FrameArrays.shapeOf(labels, name));
  }

  /// @return true if the payload is a label array
  public boolean isLabels() {
    return data instanceof int[][];
  }

  /// @return the payload as doubles
  /// @throws IllegalStateException if this is a label array
  public double[][] doubles() {
    if (data instanceof double[][] values) {
      return values;
    }
    throw new IllegalStateException("rebinned array '" + name + "' holds labels, not values");
  }

  /// @return the payload as labels
  /// @throws IllegalStateException if this is a value array
  public int[][] ints() {
    if (data instanceof int[][] labels) {
      return labels;
    }
    throw new IllegalStateException("rebinned array '" + name + "' holds values, not labels");
  }

  /// @return the sum of all cells, for value arrays
  public double sum() {
    double total = 0.0d;
    for (double[] row : doubles()) {
      for (double v : row) {
        total += v;
      }
    }
    return total;
  }
}

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

/// Summary statistics of one frame dataset, as printed by the inspect command.
/// @param name the dataset name
/// @param shape the dataset shape
/// @param elementType the stored element type
/// @param min the smallest cell value
/// @param max the largest cell value
/// @param mean the mean cell value
/// @param stddev the population standard deviation of the cell values
/// @param sum the sum of all cells
/// @param nonZero the number of cells which are not zero
public record FrameStatistics(
    String name,
    FrameShape shape,
    String elementType,
    double min,
    double max,
    double mean,
    double stddev,
    double sum,
    long nonZero
)
{

  /// compute statistics over a two-dimensional numeric array
  /// @param name the dataset name
  /// @param data the array, of any element type {@link FrameArrays} supports
  /// @return the statistics, with NaN moments for an empty array
  public static FrameStatistics of(String name, Object data) {
    FrameShape shape = FrameArrays.shapeOf(data, name);
    double[][] values = FrameArrays.toDoubles(data, name);
    long count = shape.cells();
    if (count == 0) {
      return new FrameStatistics(name, shape, FrameArrays.elementType(data), Double.NaN,
          Double.NaN, Double.NaN, Double.NaN, 0.0d, 0L);
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0.0d;
    long nonZero = 0;
    for (double[] row : values) {
      for (double v : row) {
        min = Math.min(min, v);
        max = Math.max(max, v);
        sum += v;
        if (v != 0.0d) {
          nonZero++;
        }
      }
    }
    double mean = sum / count;
    double squares = 0.0d;
    for (double[] row : values) {
      for (double v : row) {
        double d = v - mean;
        squares += d * d;
      }
    }
    return new FrameStatistics(name, shape, FrameArrays.elementType(data), min, max, mean,
        Math.sqrt(squares / count), sum, nonZero);
  }
}

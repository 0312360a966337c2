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

import io.nosqlbench.nbframes.frame.FrameArrays;
import io.nosqlbench.nbframes.frame.FrameShape;

/// Block-sums continuous plane slices.
///
/// Each output cell is the plain arithmetic sum of the source cells in its block.
/// Negative values pass through unchanged. Blocks at the trailing edges may hold
/// fewer cells than a full block; they are summed as they are, with no padding and
/// no area correction, so edge cells under-report intensity relative to interior
/// cells while the plane total is conserved exactly.
public final class BlockReducer {

  private BlockReducer() {
  }

  /// sum a plane slice block by block
  /// @param rows the plane slice, one row per channel; not modified
  /// @param factors the block shape
  /// @return the reduced array of shape `factors.reducedShape(shape of rows)`
  public static double[][] sum(double[][] rows, RebinFactors factors) {
    FrameShape shape = FrameArrays.shapeOf(rows, "plane slice");
    BlockGrid grid = new BlockGrid(shape.channels(), shape.ticks(), factors);
    double[][] out = new double[grid.blockRows()][grid.blockCols()];
    for (int br = 0; br < grid.blockRows(); br++) {
      double[] target = out[br];
      for (int r = grid.rowStart(br); r < grid.rowEnd(br); r++) {
        double[] source = rows[r];
        for (int bc = 0; bc < grid.blockCols(); bc++) {
          double acc = 0.0d;
          for (int c = grid.colStart(bc); c < grid.colEnd(bc); c++) {
            acc += source[c];
          }
          target[bc] += acc;
        }
      }
    }
    return out;
  }
}

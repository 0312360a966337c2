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

/// The tiling of a `rows x cols` array into blocks of `rowFactor x colFactor` cells,
/// starting at (0, 0). The last block row and column may be narrower.
/// @param rows the number of source rows
/// @param cols the number of source columns
/// @param factors the block shape
public record BlockGrid(int rows, int cols, RebinFactors factors) {

  /// @param extent a source extent
  /// @param factor a block extent
  /// @return the number of blocks needed to cover extent, partial blocks included
  public static int blockCount(int extent, int factor) {
    return extent == 0 ? 0 : 1 + (extent - 1) / factor;
  }

  /// @return the number of block rows
  public int blockRows() {
    return blockCount(rows, factors.channelFactor());
  }

  /// @return the number of block columns
  public int blockCols() {
    return blockCount(cols, factors.tickFactor());
  }

  /// @param blockRow a block row index
  /// @return the first source row of the block row
  public int rowStart(int blockRow) {
    return blockRow * factors.channelFactor();
  }

  /// @param blockRow a block row index
  /// @return the source row after the last row of the block row
  public int rowEnd(int blockRow) {
    return (int) Math.min((long) rowStart(blockRow) + factors.channelFactor(), rows);
  }

  /// @param blockCol a block column index
  /// @return the first source column of the block column
  public int colStart(int blockCol) {
    return blockCol * factors.tickFactor();
  }

  /// @param blockCol a block column index
  /// @return the source column after the last column of the block column
  public int colEnd(int blockCol) {
    return (int) Math.min((long) colStart(blockCol) + factors.tickFactor(), cols);
  }
}

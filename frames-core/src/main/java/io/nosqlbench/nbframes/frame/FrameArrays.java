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

import java.lang.reflect.Array;

/// Conversions from the two-dimensional primitive arrays handed out by array stores
/// into the representations the rebinning engine works on.
///
/// Continuous and weight data is widened to `double[][]`, label data is narrowed to
/// `int[][]`. Supported element types are byte, short, int, long, float and double.
public final class FrameArrays {

  private FrameArrays() {
  }

  /// determine the shape of a rectangular two-dimensional array
  /// @param data a two-dimensional primitive array
  /// @param name the dataset name, for error messages
  /// @return the shape of the array
  /// @throws IllegalArgumentException if the array is not two-dimensional or is ragged
  public static FrameShape shapeOf(Object data, String name) {
    if (data == null || !data.getClass().isArray()
        || !data.getClass().getComponentType().isArray())
    {
      throw new IllegalArgumentException("dataset '" + name + "' is not a two-dimensional array: "
                                         + (data == null ? "null" : data.getClass().getSimpleName()));
    }
    int rows = Array.getLength(data);
    int cols = rows == 0 ? 0 : Array.getLength(Array.get(data, 0));
    for (int r = 1; r < rows; r++) {
      int len = Array.getLength(Array.get(data, r));
      if (len != cols) {
        throw new IllegalArgumentException("dataset '" + name + "' is ragged: row " + r + " has "
                                           + len + " columns, expected " + cols);
      }
    }
    return new FrameShape(rows, cols);
  }

  /// the simple name of the element type of a two-dimensional array, like `int` or `float`
  /// @param data a two-dimensional primitive array
  /// @return the element type name
  public static String elementType(Object data) {
    Class<?> type = data.getClass();
    while (type.isArray()) {
      type = type.getComponentType();
    }
    return type.getSimpleName();
  }

  /// widen any supported two-dimensional numeric array to doubles
  /// @param data the source array, which is not modified
  /// @param name the dataset name, for error messages
  /// @return a new array, or the same instance if it already is a `double[][]`
  public static double[][] toDoubles(Object data, String name) {
    if (data instanceof double[][] doubles) {
      return doubles;
    }
    FrameShape shape = shapeOf(data, name);
    double[][] out = new double[shape.channels()][shape.ticks()];
    if (data instanceof float[][] floats) {
      for (int r = 0; r < floats.length; r++) {
        for (int c = 0; c < floats[r].length; c++) {
          out[r][c] = floats[r][c];
        }
      }
    } else if (data instanceof int[][] ints) {
      for (int r = 0; r < ints.length; r++) {
        for (int c = 0; c < ints[r].length; c++) {
          out[r][c] = ints[r][c];
        }
      }
    } else if (data instanceof long[][] longs) {
      for (int r = 0; r < longs.length; r++) {
        for (int c = 0; c < longs[r].length; c++) {
          out[r][c] = longs[r][c];
        }
      }
    } else if (data instanceof short[][] shorts) {
      for (int r = 0; r < shorts.length; r++) {
        for (int c = 0; c < shorts[r].length; c++) {
          out[r][c] = shorts[r][c];
        }
      }
    } else if (data instanceof byte[][] bytes) {
      for (int r = 0; r < bytes.length; r++) {
        for (int c = 0; c < bytes[r].length; c++) {
          out[r][c] = bytes[r][c];
        }
      }
    } else {
      throw unsupported(data, name);
    }
    return out;
  }

  /// narrow any supported two-dimensional numeric array to integer labels
  ///
  /// Floating point labels are truncated toward zero. Long labels which do not fit in an
  /// int are rejected.
  /// @param data the source array, which is not modified
  /// @param name the dataset name, for error messages
  /// @return a new array, or the same instance if it already is an `int[][]`
  public static int[][] toInts(Object data, String name) {
    if (data instanceof int[][] ints) {
      return ints;
    }
    FrameShape shape = shapeOf(data, name);
    int[][] out = new int[shape.channels()][shape.ticks()];
    if (data instanceof long[][] longs) {
      for (int r = 0; r < longs.length; r++) {
        for (int c = 0; c < longs[r].length; c++) {
          long v = longs[r][c];
          if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("label " + v + " in dataset '" + name + "' at ["
                                               + r + "," + c + "] does not fit in an int");
          }
          out[r][c] = (int) v;
        }
      }
    } else if (data instanceof double[][] doubles) {
      for (int r = 0; r < doubles.length; r++) {
        for (int c = 0; c < doubles[r].length; c++) {
          out[r][c] = (int) doubles[r][c];
        }
      }
    } else if (data instanceof float[][] floats) {
      for (int r = 0; r < floats.length; r++) {
        for (int c = 0; c < floats[r].length; c++) {
          out[r][c] = (int) floats[r][c];
        }
      }
    } else if (data instanceof short[][] shorts) {
      for (int r = 0; r < shorts.length; r++) {
        for (int c = 0; c < shorts[r].length; c++) {
          out[r][c] = shorts[r][c];
        }
      }
    } else if (data instanceof byte[][] bytes) {
      for (int r = 0; r < bytes.length; r++) {
        for (int c = 0; c < bytes[r].length; c++) {
          out[r][c] = bytes[r][c];
        }
      }
    } else {
      throw unsupported(data, name);
    }
    return out;
  }

  private static IllegalArgumentException unsupported(Object data, String name) {
    return new IllegalArgumentException("dataset '" + name + "' has unsupported element type "
                                        + (data == null ? "null" : elementType(data)));
  }
}

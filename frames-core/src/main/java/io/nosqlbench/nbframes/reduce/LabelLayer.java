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

/// One label slice and the weight slice that ranks it.
/// @param labels the entity labels, one row per channel
/// @param weights the weight of each label cell, same shape as labels
public record LabelLayer(int[][] labels, double[][] weights) {

  public LabelLayer {
    FrameShape labelShape = FrameArrays.shapeOf(labels, "labels");
    FrameShape weightShape = FrameArrays.shapeOf(weights, "weights");
    if (!labelShape.equals(weightShape)) {
      throw new IllegalArgumentException(
          "label slice " + labelShape + " and weight slice " + weightShape + " differ in shape");
    }
  }

  /// @return the shape of both slices
  public FrameShape shape() {
    return new FrameShape(labels.length, labels.length == 0 ? 0 : labels[0].length);
  }
}

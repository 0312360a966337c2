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

/// A frame of additive magnitudes, such as deconvolved signal or deposited charge.
///
/// The rows are shared with the caller and must be treated as read-only.
/// @param name the dataset name
/// @param values the cell values, indexed `[channel][tick]`
public record ContinuousFrame(String name, double[][] values) implements Frame {

  public ContinuousFrame {
    FrameArrays.shapeOf(values, name);
  }

  @Override
  public FrameShape shape() {
    return new FrameShape(values.length, values.length == 0 ? 0 : values[0].length);
  }
}

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

/// A frame of integer entity labels, such as track ids or particle type codes.
///
/// Label `0` means no entity contributed to the cell. The rows are shared with the
/// caller and must be treated as read-only.
/// @param name the dataset name
/// @param labels the cell labels, indexed `[channel][tick]`
public record LabelFrame(String name, int[][] labels) implements Frame {

  /// the label reserved for cells without any contributing entity
  public static final int NO_ENTITY = 0;

  public LabelFrame {
    FrameArrays.shapeOf(labels, name);
  }

  @Override
  public FrameShape shape() {
    return new FrameShape(labels.length, labels.length == 0 ? 0 : labels[0].length);
  }
}

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

package io.nosqlbench.nbframes.classify;

import io.nosqlbench.nbframes.RebinException;

/// Thrown when a label frame is present but the weight frame it pairs with is not.
public class MissingWeightFrameException extends RebinException {

  private final String labelFrame;
  private final String weightFrame;

  /// @param labelFrame the label frame type
  /// @param weightFrame the expected weight frame type
  public MissingWeightFrameException(String labelFrame, String weightFrame) {
    super("label frame '" + labelFrame + "' needs weight frame '" + weightFrame
          + "', which is not in the input");
    this.labelFrame = labelFrame;
    this.weightFrame = weightFrame;
  }

  /// @return the label frame type
  public String getLabelFrame() {
    return labelFrame;
  }

  /// @return the expected weight frame type
  public String getWeightFrame() {
    return weightFrame;
  }
}

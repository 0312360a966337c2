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

/// Thrown when a frame dataset name is neither continuous, categorical nor ignored.
public class UnknownFrameKindException extends RebinException {

  private final String datasetName;

  /// @param datasetName the dataset which could not be classified
  /// @param frameType the name left after the frame prefix was stripped
  public UnknownFrameKindException(String datasetName, String frameType) {
    super("cannot classify frame dataset '" + datasetName + "' (type '" + frameType
          + "'): it is not a known continuous frame, label family or ignored name");
    this.datasetName = datasetName;
  }

  /// @return the dataset which could not be classified
  public String getDatasetName() {
    return datasetName;
  }
}

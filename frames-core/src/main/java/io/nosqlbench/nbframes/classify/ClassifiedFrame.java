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

/// The classification of one dataset name.
/// @param datasetName the name as it appears in the source
/// @param frameType the name with the frame prefix removed
/// @param kind how the dataset is rebinned
/// @param family for label frames, the label family, otherwise null
/// @param layer for layered label frames, the layer suffix, otherwise null
/// @param weightType for label frames, the paired weight frame type, otherwise null
public record ClassifiedFrame(
    String datasetName,
    String frameType,
    FrameKind kind,
    String family,
    String layer,
    String weightType
)
{

  static ClassifiedFrame continuous(String datasetName, String frameType) {
    return new ClassifiedFrame(datasetName, frameType, FrameKind.CONTINUOUS, null, null, null);
  }

  static ClassifiedFrame ignored(String datasetName, String frameType) {
    return new ClassifiedFrame(datasetName, frameType, FrameKind.IGNORED, null, null, null);
  }

  static ClassifiedFrame labels(
      String datasetName,
      String frameType,
      String family,
      String layer,
      String weightType
  )
  {
    return new ClassifiedFrame(datasetName, frameType, FrameKind.CATEGORICAL, family, layer,
        weightType);
  }
}

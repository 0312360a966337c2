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

package io.nosqlbench.nbframes.rebin;

import io.nosqlbench.nbframes.RebinException;
import io.nosqlbench.nbframes.frame.FrameShape;

/// A participating frame does not have the shape the run requires.
public class ShapeMismatchException extends RebinException {

  private final String datasetName;
  private final FrameShape expected;
  private final FrameShape actual;

  /// @param datasetName the offending dataset
  /// @param expected the shape required for this run
  /// @param actual the shape found
  /// @param reason what the expected shape is derived from
  public ShapeMismatchException(
      String datasetName,
      FrameShape expected,
      FrameShape actual,
      String reason
  )
  {
    super("dataset '" + datasetName + "' has shape " + actual + " but " + reason + " requires "
          + expected);
    this.datasetName = datasetName;
    this.expected = expected;
    this.actual = actual;
  }

  public String getDatasetName() {
    return datasetName;
  }

  public FrameShape getExpected() {
    return expected;
  }

  public FrameShape getActual() {
    return actual;
  }
}

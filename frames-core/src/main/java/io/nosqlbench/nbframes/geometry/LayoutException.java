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

package io.nosqlbench.nbframes.geometry;

import io.nosqlbench.nbframes.RebinException;

/// Thrown when a detector layout is internally inconsistent: plane ranges overlap,
/// leave gaps, run out of order, or do not match the declared channel counts.
///
/// Raised while the layout is constructed, before any frame is touched.
public class LayoutException extends RebinException {

  /// @param message what is inconsistent about the layout
  public LayoutException(String message) {
    super(message);
  }

  /// @param message what is inconsistent about the layout
  /// @param cause the underlying parse or access failure
  public LayoutException(String message, Throwable cause) {
    super(message, cause);
  }
}

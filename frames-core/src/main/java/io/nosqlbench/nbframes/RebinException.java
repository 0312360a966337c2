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

package io.nosqlbench.nbframes;

/// Base type of every failure raised while rebinning frames.
///
/// All subtypes are fatal for a run. Nothing is published to a sink once one
/// of these has been thrown.
public class RebinException extends RuntimeException {

  /// create a rebin failure
  /// @param message the failure description
  public RebinException(String message) {
    super(message);
  }

  /// create a rebin failure with a cause
  /// @param message the failure description
  /// @param cause the underlying cause
  public RebinException(String message, Throwable cause) {
    super(message, cause);
  }
}

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

package io.nosqlbench.nbframes.io;

import io.nosqlbench.nbframes.RebinException;

/// A frame store could not be read or written.
public class FrameStoreException extends RebinException {

  private final String location;

  /// create a store failure
  /// @param location the file, group or dataset involved
  /// @param message the failure description
  public FrameStoreException(String location, String message) {
    super(location + ": " + message);
    this.location = location;
  }

  /// create a store failure wrapping an I/O error
  /// @param location the file, group or dataset involved
  /// @param message the failure description
  /// @param cause the underlying error
  public FrameStoreException(String location, String message, Throwable cause) {
    super(location + ": " + message, cause);
    this.location = location;
  }

  /// @return the file, group or dataset involved
  public String getLocation() {
    return location;
  }
}

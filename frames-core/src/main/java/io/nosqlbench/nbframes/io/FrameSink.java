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

import io.nosqlbench.nbframes.frame.RebinnedArray;

/// Receives the arrays of one rebin run and publishes them together.
///
/// Arrays passed to [#put(RebinnedArray)] are staged. Nothing is visible to
/// readers of the sink's target until [#commit()] returns. After [#abort()], no
/// staged array is ever published. A sink is used for one run only.
public interface FrameSink extends AutoCloseable {

  /// stage an output array
  /// @param array the array, which must not be modified afterwards
  /// @throws IllegalStateException if the name was already staged, or the sink is closed
  void put(RebinnedArray array);

  /// publish all staged arrays
  /// @throws FrameStoreException if publishing fails, in which case nothing is published
  void commit();

  /// discard all staged arrays
  void abort();

  /// release the sink; staged arrays of an uncommitted sink are discarded
  @Override
  default void close() {
  }
}

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

import io.nosqlbench.nbframes.frame.ContinuousFrame;
import io.nosqlbench.nbframes.frame.FrameArrays;
import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.frame.LabelFrame;

import java.util.List;

/// Read access to a set of named two-dimensional arrays.
///
/// Shapes and element types must be available without reading array data, so the
/// rebinner can validate every participating frame before it reads any of them.
public interface FrameSource extends AutoCloseable {

  /// @return the dataset names, in a stable order
  List<String> names();

  /// @param name a dataset name
  /// @return true if this source holds the dataset
  default boolean contains(String name) {
    return names().contains(name);
  }

  /// @param name a dataset name
  /// @return the shape of the dataset
  /// @throws FrameStoreException if the dataset is missing or not two-dimensional
  FrameShape shape(String name);

  /// @param name a dataset name
  /// @return the element type name, like `float` or `int`
  String elementType(String name);

  /// @param name a dataset name
  /// @return the dataset as a two-dimensional primitive array
  /// @throws FrameStoreException if the dataset cannot be read
  Object readArray(String name);

  /// read a dataset as additive values
  /// @param name a dataset name
  /// @return the frame
  default ContinuousFrame readContinuous(String name) {
    return new ContinuousFrame(name, FrameArrays.toDoubles(readArray(name), name));
  }

  /// read a dataset as entity labels
  /// @param name a dataset name
  /// @return the frame
  default LabelFrame readLabels(String name) {
    return new LabelFrame(name, FrameArrays.toInts(readArray(name), name));
  }

  @Override
  default void close() {
  }
}

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

import io.nosqlbench.nbframes.frame.FrameArrays;
import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.frame.RebinnedArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A frame source and sink held entirely in memory.
///
/// Input datasets are added with [#add(String, Object)]. Rebinned arrays are staged
/// by [#put(RebinnedArray)] and only appear in [#outputs()] after [#commit()].
public class InMemoryFrameStore implements FrameSource, FrameSink {

  private final Map<String, Object> inputs = new LinkedHashMap<>();
  private final Map<String, RebinnedArray> staged = new LinkedHashMap<>();
  private final Map<String, RebinnedArray> outputs = new LinkedHashMap<>();
  private boolean finished;

  /// add an input dataset
  /// @param name the dataset name
  /// @param data a two-dimensional primitive array
  /// @return this store
  public InMemoryFrameStore add(String name, Object data) {
    FrameArrays.shapeOf(data, name);
    if (inputs.putIfAbsent(name, data) != null) {
      throw new IllegalArgumentException("dataset '" + name + "' was already added");
    }
    return this;
  }

  @Override
  public List<String> names() {
    return new ArrayList<>(inputs.keySet());
  }

  @Override
  public FrameShape shape(String name) {
    return FrameArrays.shapeOf(require(name), name);
  }

  @Override
  public String elementType(String name) {
    return FrameArrays.elementType(require(name));
  }

  @Override
  public Object readArray(String name) {
    return require(name);
  }

  private Object require(String name) {
    Object data = inputs.get(name);
    if (data == null) {
      throw new FrameStoreException(name, "no such dataset in memory store");
    }
    return data;
  }

  @Override
  public synchronized void put(RebinnedArray array) {
    if (finished) {
      throw new IllegalStateException("sink was already committed or aborted");
    }
    if (staged.putIfAbsent(array.name(), array) != null) {
      throw new IllegalStateException("output '" + array.name() + "' was already staged");
    }
  }

  @Override
  public synchronized void commit() {
    if (finished) {
      throw new IllegalStateException("sink was already committed or aborted");
    }
    outputs.putAll(staged);
    staged.clear();
    finished = true;
  }

  @Override
  public synchronized void abort() {
    staged.clear();
    finished = true;
  }

  @Override
  public synchronized void close() {
    if (!finished) {
      abort();
    }
  }

  /// @return the committed arrays by name, in registration order
  public synchronized Map<String, RebinnedArray> outputs() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  /// @param name an output name
  /// @return the committed array
  public synchronized RebinnedArray output(String name) {
    RebinnedArray array = outputs.get(name);
    if (array == null) {
      throw new IllegalArgumentException("no committed output '" + name + "'");
    }
    return array;
  }
}

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

package io.nosqlbench.nbframes.io.hdf5;

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.exceptions.HdfException;
import io.nosqlbench.nbframes.frame.RebinnedArray;
import io.nosqlbench.nbframes.io.FrameSink;
import io.nosqlbench.nbframes.io.FrameStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/// Writes rebinned arrays as datasets in the root group of one HDF5 file.
///
/// Arrays are staged in memory. On [#commit()] they are written to a buffer file
/// beside the target, which is then moved over the target. The target is never
/// left partially written, and is untouched if the run aborts.
public class Hdf5FrameSink implements FrameSink {
  private static final Logger logger = LogManager.getLogger(Hdf5FrameSink.class);

  private final Path target;
  private final Map<String, RebinnedArray> staged = new LinkedHashMap<>();
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private boolean finished;

  /// @param target the file to create or replace on commit
  public Hdf5FrameSink(Path target) {
    this.target = target.toAbsolutePath().normalize();
  }

  /// @return the file written on commit
  public Path target() {
    return target;
  }

  /// set a root attribute to be written with the datasets
  /// @param name the attribute name
  /// @param value a string or boxed number
  /// @return this sink
  public Hdf5FrameSink attribute(String name, Object value) {
    attributes.put(name, value);
    return this;
  }

  @Override
  public synchronized void put(RebinnedArray array) {
    checkOpen();
    if (staged.putIfAbsent(array.name(), array) != null) {
      throw new IllegalStateException("output '" + array.name() + "' was already staged");
    }
  }

  @Override
  public synchronized void commit() {
    checkOpen();
    finished = true;
    Path dir = target.getParent();
    Path buffer = null;
    try {
      Files.createDirectories(dir);
      buffer = Files.createTempFile(dir, ".hdf5buffer", ".hdf5");
      try (WritableHdfFile writable = HdfFile.write(buffer)) {
        for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
          writable.putAttribute(attribute.getKey(), attribute.getValue());
        }
        for (RebinnedArray array : staged.values()) {
          writable.putDataset(array.name(), array.data());
        }
      }
      move(buffer, target);
      logger.info("wrote {} datasets to {}", staged.size(), target);
    } catch (IOException | HdfException e) {
      deleteQuietly(buffer);
      throw new FrameStoreException(target.toString(), "unable to write rebinned frames", e);
    } finally {
      staged.clear();
    }
  }

  private static void move(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      logger.debug("atomic move not supported for {}, falling back to replace", to);
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  @Override
  public synchronized void abort() {
    if (!staged.isEmpty()) {
      logger.debug("discarding {} staged datasets for {}", staged.size(), target);
    }
    staged.clear();
    finished = true;
  }

  @Override
  public synchronized void close() {
    if (!finished) {
      abort();
    }
  }

  private void checkOpen() {
    if (finished) {
      throw new IllegalStateException("sink for " + target + " was already committed or aborted");
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.warn("unable to delete buffer file {}: {}", path, e.getMessage());
    }
  }
}

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
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.io.FrameSource;
import io.nosqlbench.nbframes.io.FrameStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Frame datasets read from one group of one or more HDF5 files.
///
/// The datasets of all files are merged into one namespace, in argument order. The
/// same dataset name in two files is an error. Files stay open until [#close()], and
/// dataset contents are only read on [#readArray(String)].
public class Hdf5FrameSource implements FrameSource {
  private static final Logger logger = LogManager.getLogger(Hdf5FrameSource.class);

  private final List<HdfFile> files = new ArrayList<>();
  private final Map<String, Located> datasets = new LinkedHashMap<>();

  private record Located(FrameFileSpec file, Dataset dataset) {
  }

  /// open the given files
  /// @param specs the files and groups to read
  /// @throws FrameStoreException if a file cannot be opened, a group is missing, or a
  ///     dataset name occurs in two files
  public Hdf5FrameSource(List<FrameFileSpec> specs) {
    try {
      for (FrameFileSpec spec : specs) {
        open(spec);
      }
    } catch (RuntimeException e) {
      close();
      throw e;
    }
  }

  /// @param specs the files and groups to read
  public static Hdf5FrameSource open(FrameFileSpec... specs) {
    return new Hdf5FrameSource(Arrays.asList(specs));
  }

  private void open(FrameFileSpec spec) {
    if (!Files.isRegularFile(spec.path())) {
      throw new FrameStoreException(spec.path().toString(), "no such file");
    }
    HdfFile hdf;
    try {
      hdf = new HdfFile(spec.path());
    } catch (HdfException e) {
      throw new FrameStoreException(spec.path().toString(), "not a readable HDF5 file", e);
    }
    files.add(hdf);

    Group group;
    if (spec.isRootGroup()) {
      group = hdf;
    } else {
      Node node;
      try {
        node = hdf.getByPath(spec.group());
      } catch (HdfException e) {
        throw new FrameStoreException(spec.toString(), "group not found", e);
      }
      if (!(node instanceof Group g)) {
        throw new FrameStoreException(spec.toString(), "is not a group");
      }
      group = g;
    }

    int count = 0;
    for (Map.Entry<String, Node> child : group.getChildren().entrySet()) {
      if (!(child.getValue() instanceof Dataset dataset)) {
        logger.debug("{}: skipping non-dataset node {}", spec, child.getKey());
        continue;
      }
      Located previous = datasets.putIfAbsent(child.getKey(), new Located(spec, dataset));
      if (previous != null) {
        throw new FrameStoreException(spec.toString(), "dataset '" + child.getKey()
                                                       + "' is also provided by " + previous.file());
      }
      count++;
    }
    logger.info("opened {} with {} datasets", spec, count);
  }

  @Override
  public List<String> names() {
    return new ArrayList<>(datasets.keySet());
  }

  @Override
  public boolean contains(String name) {
    return datasets.containsKey(name);
  }

  @Override
  public FrameShape shape(String name) {
    Located located = require(name);
    int[] dims = located.dataset().getDimensions();
    if (dims.length != 2) {
      throw new FrameStoreException(located.file() + "/" + name,
          "expected a two-dimensional dataset, found dimensions " + Arrays.toString(dims));
    }
    return new FrameShape(dims[0], dims[1]);
  }

  @Override
  public String elementType(String name) {
    return require(name).dataset().getJavaType().getSimpleName();
  }

  /// @param name a dataset name
  /// @return the file the dataset comes from
  public FrameFileSpec fileOf(String name) {
    return require(name).file();
  }

  @Override
  public Object readArray(String name) {
    Located located = require(name);
    shape(name);
    logger.debug("reading {} from {}", name, located.file());
    try {
      return located.dataset().getData();
    } catch (HdfException e) {
      throw new FrameStoreException(located.file() + "/" + name, "unable to read dataset", e);
    }
  }

  private Located require(String name) {
    Located located = datasets.get(name);
    if (located == null) {
      throw new FrameStoreException(name, "no such dataset in " + files.size() + " open files");
    }
    return located;
  }

  @Override
  public void close() {
    for (HdfFile file : files) {
      file.close();
    }
    files.clear();
  }
}

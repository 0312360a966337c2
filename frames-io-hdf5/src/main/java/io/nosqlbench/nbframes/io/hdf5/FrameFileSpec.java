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

import java.nio.file.Path;

/// One HDF5 file and the group within it that holds frame datasets.
/// @param path the file
/// @param group the absolute group path, `/` for the root group
public record FrameFileSpec(Path path, String group) {

  /// the group event frames are written to by the upstream simulation
  public static final String DEFAULT_GROUP = "/1";

  public FrameFileSpec {
    if (path == null) {
      throw new IllegalArgumentException("frame file path is required");
    }
    group = normalizeGroup(group);
  }

  /// @param path a file whose frames live in the default group
  public static FrameFileSpec of(Path path) {
    return new FrameFileSpec(path, DEFAULT_GROUP);
  }

  /// parse `path[:group]`
  /// @param spec the file spec, like `g4-rec.h5` or `g4-rec.h5:/2`
  /// @return the parsed spec
  public static FrameFileSpec parse(String spec) {
    if (spec == null || spec.isBlank()) {
      throw new IllegalArgumentException("frame file spec must not be empty");
    }
    int colon = spec.lastIndexOf(':');
    // a colon followed by a path separator is a drive letter, not a group
    if (colon > 0 && colon < spec.length() - 1 && spec.charAt(colon + 1) != '\\') {
      return new FrameFileSpec(Path.of(spec.substring(0, colon)), spec.substring(colon + 1));
    }
    return of(Path.of(spec));
  }

  private static String normalizeGroup(String group) {
    if (group == null || group.isBlank()) {
      return DEFAULT_GROUP;
    }
    String normalized = group.startsWith("/") ? group : "/" + group;
    while (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  /// @return true if the frames are in the file's root group
  public boolean isRootGroup() {
    return "/".equals(group);
  }

  @Override
  public String toString() {
    return path + ":" + group;
  }
}

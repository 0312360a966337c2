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

package io.nosqlbench.nbframes.classify;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The dataset naming rules used to classify frames.
///
/// A dataset is frame data only if its name contains {@link #marker()}
/// (case-insensitive). Its frame type is the name with {@link #prefix()} removed.
/// Label frames are named `<family>` or `<family>_<layer>`, and pair with the weight
/// frame `<weightBase>` or `<weightBase>_<layer>`.
///
/// @param marker the substring that marks frame datasets
/// @param prefix the prefix removed from frame dataset names
/// @param labelFamilies the label families, in output order
/// @param layers the contribution layer suffixes, in ranking order
/// @param weightBase the frame type that weights label frames
/// @param continuousTypes the frame types summed as continuous data
/// @param ignoredTypes the frame types excluded from rebinning
public record FrameNamingConvention(
    String marker,
    String prefix,
    List<String> labelFamilies,
    List<String> layers,
    String weightBase,
    Set<String> continuousTypes,
    Set<String> ignoredTypes
)
{

  public FrameNamingConvention {
    if (marker == null || marker.isEmpty()) {
      throw new IllegalArgumentException("frame marker must not be empty");
    }
    if (weightBase == null || weightBase.isEmpty()) {
      throw new IllegalArgumentException("weight frame base name must not be empty");
    }
    prefix = prefix == null ? "" : prefix;
    labelFamilies = List.copyOf(labelFamilies);
    layers = List.copyOf(layers);
    continuousTypes = Set.copyOf(continuousTypes);
    ignoredTypes = Set.copyOf(ignoredTypes);
  }

  /// The conventions of simulated truth and reconstruction frame files: `frame_gauss`
  /// style continuous frames, and track or particle id labels with 1st and 2nd
  /// contribution layers weighted by `charge_1st` and `charge_2nd`.
  /// @return the default naming convention
  public static FrameNamingConvention defaults() {
    return new FrameNamingConvention(
        "frame",
        "frame_",
        List.of("orig_trackid", "orig_pid", "current_pid"),
        List.of("1st", "2nd"),
        "charge",
        Set.of("gauss", "wiener", "raw", "charge", "charge_1st", "charge_2nd"),
        Set.of()
    );
  }

  /// @param more additional continuous frame types
  /// @return a copy of this convention which also sums the given types
  public FrameNamingConvention withContinuous(List<String> more) {
    Set<String> merged = new LinkedHashSet<>(continuousTypes);
    merged.addAll(more);
    return new FrameNamingConvention(marker, prefix, labelFamilies, layers, weightBase, merged,
        ignoredTypes);
  }

  /// @param more additional label families
  /// @return a copy of this convention which also ranks the given families
  public FrameNamingConvention withLabelFamilies(List<String> more) {
    List<String> merged = new ArrayList<>(labelFamilies);
    for (String family : more) {
      if (!merged.contains(family)) {
        merged.add(family);
      }
    }
    return new FrameNamingConvention(marker, prefix, merged, layers, weightBase, continuousTypes,
        ignoredTypes);
  }

  /// @param more frame types to exclude
  /// @return a copy of this convention which also ignores the given types
  public FrameNamingConvention withIgnored(List<String> more) {
    Set<String> merged = new LinkedHashSet<>(ignoredTypes);
    merged.addAll(more);
    return new FrameNamingConvention(marker, prefix, labelFamilies, layers, weightBase,
        continuousTypes, merged);
  }

  /// @param layer a layer suffix, or null for an unlayered pair
  /// @return the weight frame type for that layer
  public String weightTypeFor(String layer) {
    return layer == null ? weightBase : weightBase + "_" + layer;
  }
}

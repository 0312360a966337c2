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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Which datasets of a source take part in a rebinning run, and how.
///
/// @param continuous the continuous frames, sorted by frame type
/// @param families the label families present, in convention order
/// @param skipped frame datasets left out under {@link UnknownFramePolicy#skip}
/// @param ignored datasets which are not frame data or are explicitly ignored
public record FramePlan(
    List<ClassifiedFrame> continuous,
    List<LabelFamily> families,
    List<String> skipped,
    List<String> ignored
)
{

  public FramePlan {
    continuous = List.copyOf(continuous);
    families = List.copyOf(families);
    skipped = List.copyOf(skipped);
    ignored = List.copyOf(ignored);
  }

  /// One label contribution layer and the dataset that weights it.
  /// @param layer the layer suffix, or null when the family is unlayered
  /// @param labelDataset the label dataset name
  /// @param weightDataset the weight dataset name
  public record LayerRef(String layer, String labelDataset, String weightDataset) {
  }

  /// All layers of one label family, ranked together.
  /// @param family the family name, which is also the output frame type
  /// @param layers the layers, in convention order
  public record LabelFamily(String family, List<LayerRef> layers) {
    public LabelFamily {
      layers = List.copyOf(layers);
    }
  }

  /// @return every dataset the run reads, in a stable order
  public Set<String> participatingDatasets() {
    Set<String> names = new LinkedHashSet<>();
    for (ClassifiedFrame frame : continuous) {
      names.add(frame.datasetName());
    }
    for (LabelFamily family : families) {
      for (LayerRef ref : family.layers()) {
        names.add(ref.labelDataset());
        names.add(ref.weightDataset());
      }
    }
    return names;
  }

  /// @return true if no dataset takes part
  public boolean isEmpty() {
    return continuous.isEmpty() && families.isEmpty();
  }
}

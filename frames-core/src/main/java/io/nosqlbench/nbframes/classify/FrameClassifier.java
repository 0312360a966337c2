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

import io.nosqlbench.nbframes.RebinException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Decides, from its name alone, how each dataset of a source is rebinned.
///
/// Only datasets whose name contains the frame marker are frame data; everything
/// else in the source is ignored without complaint. Frame datasets are classified
/// in this order: explicitly ignored types, label families, continuous types. A
/// frame dataset matching none of them is handled per the {@link UnknownFramePolicy}.
public class FrameClassifier {
  private static final Logger logger = LogManager.getLogger(FrameClassifier.class);

  private final FrameNamingConvention naming;
  private final UnknownFramePolicy unknownPolicy;

  /// @param naming the naming rules
  /// @param unknownPolicy how to treat unclassifiable frame datasets
  public FrameClassifier(FrameNamingConvention naming, UnknownFramePolicy unknownPolicy) {
    this.naming = naming;
    this.unknownPolicy = unknownPolicy;
  }

  /// @return a classifier with the default naming rules which fails on unknown frames
  public static FrameClassifier defaults() {
    return new FrameClassifier(FrameNamingConvention.defaults(), UnknownFramePolicy.fail);
  }

  /// @return the naming rules in use
  public FrameNamingConvention naming() {
    return naming;
  }

  /// classify one dataset name
  /// @param datasetName the dataset name as it appears in the source
  /// @return the classification
  /// @throws UnknownFrameKindException if this is frame data of no known kind
  public ClassifiedFrame classify(String datasetName) {
    return match(datasetName).orElseThrow(
        () -> new UnknownFrameKindException(datasetName, frameType(datasetName)));
  }

  /// @param datasetName a dataset name
  /// @return true if the name carries the frame marker
  public boolean isFrameData(String datasetName) {
    return datasetName.toLowerCase(Locale.ROOT).contains(naming.marker().toLowerCase(Locale.ROOT));
  }

  /// @param datasetName a dataset name
  /// @return the frame type, which is the name without the frame prefix
  public String frameType(String datasetName) {
    if (!naming.prefix().isEmpty() && datasetName.startsWith(naming.prefix())) {
      return datasetName.substring(naming.prefix().length());
    }
    return datasetName;
  }

  private Optional<ClassifiedFrame> match(String datasetName) {
    String type = frameType(datasetName);
    if (!isFrameData(datasetName) || naming.ignoredTypes().contains(type)) {
      return Optional.of(ClassifiedFrame.ignored(datasetName, type));
    }
    for (String family : naming.labelFamilies()) {
      if (type.equals(family)) {
        return Optional.of(ClassifiedFrame.labels(datasetName, type, family, null,
            naming.weightTypeFor(null)));
      }
      if (type.startsWith(family + "_")) {
        String layer = type.substring(family.length() + 1);
        if (naming.layers().contains(layer)) {
          return Optional.of(ClassifiedFrame.labels(datasetName, type, family, layer,
              naming.weightTypeFor(layer)));
        }
      }
    }
    if (naming.continuousTypes().contains(type)) {
      return Optional.of(ClassifiedFrame.continuous(datasetName, type));
    }
    return Optional.empty();
  }

  /// classify every dataset of a source and pair label frames with their weights
  /// @param datasetNames the dataset names of the source
  /// @return the plan for a rebinning run
  /// @throws UnknownFrameKindException under {@link UnknownFramePolicy#fail}, for the first
  /// unclassifiable frame dataset in name order
  /// @throws MissingWeightFrameException if a label frame's weight frame is absent
  public FramePlan plan(Collection<String> datasetNames) {
    List<String> names = new ArrayList<>(datasetNames);
    names.sort(Comparator.naturalOrder());

    Map<String, String> datasetByType = new HashMap<>();
    List<ClassifiedFrame> continuous = new ArrayList<>();
    List<ClassifiedFrame> labels = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> ignored = new ArrayList<>();

    for (String name : names) {
      Optional<ClassifiedFrame> matched = match(name);
      if (matched.isEmpty()) {
        if (unknownPolicy == UnknownFramePolicy.fail) {
          throw new UnknownFrameKindException(name, frameType(name));
        }
        logger.warn("skipping frame dataset '{}': no naming convention matches '{}'",
            name, frameType(name));
        skipped.add(name);
        continue;
      }
      ClassifiedFrame frame = matched.get();
      if (frame.kind() == FrameKind.IGNORED) {
        logger.debug("ignoring dataset '{}'", name);
        ignored.add(name);
        continue;
      }
      String previous = datasetByType.putIfAbsent(frame.frameType(), name);
      if (previous != null) {
        throw new RebinException("datasets '" + previous + "' and '" + name
                                 + "' both provide frame type '" + frame.frameType() + "'");
      }
      if (frame.kind() == FrameKind.CONTINUOUS) {
        continuous.add(frame);
      } else {
        labels.add(frame);
      }
    }
    continuous.sort(Comparator.comparing(ClassifiedFrame::frameType));

    Map<String, List<FramePlan.LayerRef>> byFamily = new LinkedHashMap<>();
    for (String family : naming.labelFamilies()) {
      for (ClassifiedFrame label : labels) {
        if (!label.family().equals(family)) {
          continue;
        }
        String weightDataset = datasetByType.get(label.weightType());
        if (weightDataset == null) {
          throw new MissingWeightFrameException(label.frameType(), label.weightType());
        }
        byFamily.computeIfAbsent(family, f -> new ArrayList<>())
            .add(new FramePlan.LayerRef(label.layer(), label.datasetName(), weightDataset));
      }
    }
    List<FramePlan.LabelFamily> families = new ArrayList<>();
    byFamily.forEach((family, refs) -> {
      refs.sort(Comparator.comparingInt(ref -> layerOrder(ref.layer())));
      families.add(new FramePlan.LabelFamily(family, refs));
    });

    logger.debug("classified {} continuous frames, {} label families, {} skipped, {} ignored",
        continuous.size(), families.size(), skipped.size(), ignored.size());
    return new FramePlan(continuous, families, skipped, ignored);
  }

  private int layerOrder(String layer) {
    return layer == null ? -1 : naming.layers().indexOf(layer);
  }
}

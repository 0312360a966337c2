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

package io.nosqlbench.nbframes.geometry;

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Loads a {@link DetectorLayout} from YAML.
///
/// ```yaml
/// units: 4
/// channels_per_unit: 3072
/// planes: [U, V, W]
/// halves:
///   - {U: [0, 476],   V: [952, 1428],  W: [1904, 2488]}
///   - {U: [476, 952], V: [1428, 1904], W: [2488, 3072]}
/// ```
///
/// Each plane entry is a half-open `[start, end)` pair of unit-local channels.
public class LayoutConfig {
  private final Map<String, Object> cfgmap;

  /// create a layout config
  /// @param cfgmap the parsed config map
  public LayoutConfig(Map<String, Object> cfgmap) {
    this.cfgmap = cfgmap;
  }

  /// read a layout config file
  /// @param layoutPath the YAML file
  /// @return a layout config
  /// @throws LayoutException if the file cannot be read or is not a YAML map
  public static LayoutConfig file(Path layoutPath) {
    LoadSettings loadSettings = LoadSettings.builder().build();
    Load yaml = new Load(loadSettings);
    try (BufferedReader reader = Files.newBufferedReader(layoutPath, StandardCharsets.UTF_8)) {
      return of(yaml.loadFromReader(reader), layoutPath.toString());
    } catch (IOException e) {
      throw new LayoutException("unable to read layout file " + layoutPath, e);
    }
  }

  /// parse a layout config from a YAML string
  /// @param yamlText the YAML text
  /// @return a layout config
  public static LayoutConfig string(String yamlText) {
    Load yaml = new Load(LoadSettings.builder().build());
    return of(yaml.loadFromString(yamlText), "<string>");
  }

  @SuppressWarnings("unchecked")
  private static LayoutConfig of(Object loaded, String source) {
    if (loaded instanceof Map<?, ?> map) {
      return new LayoutConfig((Map<String, Object>) map);
    }
    throw new LayoutException("layout " + source + " must be a YAML map, not "
                              + (loaded == null ? "empty" : loaded.getClass().getSimpleName()));
  }

  /// @return the number of top-level units
  public int getUnits() {
    return requireInt("units");
  }

  /// @return the number of channels in each unit
  public int getChannelsPerUnit() {
    return requireInt("channels_per_unit");
  }

  /// @return the plane names in plane id order
  public List<String> getPlaneNames() {
    Object planes = require("planes");
    if (!(planes instanceof List<?> list)) {
      throw new LayoutException("'planes' must be a list of plane names");
    }
    List<String> names = new ArrayList<>(list.size());
    for (Object o : list) {
      names.add(String.valueOf(o));
    }
    return names;
  }

  /// @return for each half, the range of each plane in plane id order
  public List<List<PlaneRange>> getHalves() {
    Object halves = require("halves");
    if (!(halves instanceof List<?> list)) {
      throw new LayoutException("'halves' must be a list of plane range maps");
    }
    List<String> planeNames = getPlaneNames();
    List<List<PlaneRange>> result = new ArrayList<>(list.size());
    for (int h = 0; h < list.size(); h++) {
      if (!(list.get(h) instanceof Map<?, ?> ranges)) {
        throw new LayoutException("half " + h + " must map plane names to [start, end) pairs");
      }
      if (ranges.size() != planeNames.size()) {
        throw new LayoutException("half " + h + " declares planes " + ranges.keySet()
                                  + " but the layout has planes " + planeNames);
      }
      List<PlaneRange> planeRanges = new ArrayList<>(planeNames.size());
      for (String plane : planeNames) {
        planeRanges.add(toRange(ranges.get(plane), h, plane));
      }
      result.add(planeRanges);
    }
    return result;
  }

  /// build and validate the layout
  /// @return the layout
  /// @throws LayoutException if the config is incomplete or the layout inconsistent
  public DetectorLayout toLayout() {
    return new DetectorLayout(getUnits(), getChannelsPerUnit(), getPlaneNames(), getHalves());
  }

  private static PlaneRange toRange(Object value, int half, String plane) {
    if (!(value instanceof List<?> pair) || pair.size() != 2
        || !(pair.get(0) instanceof Number start) || !(pair.get(1) instanceof Number end))
    {
      throw new LayoutException("half " + half + " plane " + plane
                                + " must be a [start, end) pair of integers, not " + value);
    }
    return new PlaneRange(start.intValue(), end.intValue());
  }

  private Object require(String key) {
    Object value = cfgmap.get(key);
    if (value == null) {
      throw new LayoutException("layout config is missing '" + key + "'");
    }
    return value;
  }

  private int requireInt(String key) {
    Object value = require(key);
    if (value instanceof Number n) {
      return n.intValue();
    }
    throw new LayoutException("layout config '" + key + "' must be an integer, not " + value);
  }
}

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

package io.nosqlbench.nbframes.rebin;

/// Builds the names of rebinned output arrays.
///
/// ```
/// <prefix>group{g}_plane{p}_{type}                 continuous sums
/// <prefix>group{g}_plane{p}_{family}_{rank}        ranked labels
/// <prefix>group{g}_plane{p}_{family}_weight_{rank} ranked weights
/// ```
/// @param prefix prepended to every name, may be empty
public record OutputNaming(String prefix) {

  public static final String FIRST = "1st";
  public static final String SECOND = "2nd";

  public OutputNaming {
    prefix = prefix == null ? "" : prefix;
  }

  /// @return names with no prefix
  public static OutputNaming plain() {
    return new OutputNaming("");
  }

  public String continuous(int group, int plane, String frameType) {
    return base(group, plane) + frameType;
  }

  public String label(int group, int plane, String family, String rank) {
    return base(group, plane) + family + "_" + rank;
  }

  public String weight(int group, int plane, String family, String rank) {
    return base(group, plane) + family + "_weight_" + rank;
  }

  private String base(int group, int plane) {
    return prefix + "group" + group + "_plane" + plane + "_";
  }
}

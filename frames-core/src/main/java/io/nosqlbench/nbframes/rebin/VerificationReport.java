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

import java.util.List;

/// The outcome of comparing a rebinned frame set against its raw frames.
/// @param checks every check that was made, in (group, plane, frame) order
public record VerificationReport(List<Check> checks) {

  public VerificationReport {
    checks = List.copyOf(checks);
  }

  /// One verified output array.
  /// @param outputName the rebinned dataset checked
  /// @param expected the expected value, for sum checks
  /// @param actual the value found, for sum checks
  /// @param passed whether the check passed
  /// @param detail a description of the failure, or of what was checked
  public record Check(String outputName, double expected, double actual, boolean passed,
                      String detail)
  {
  }

  public boolean passed() {
    return checks.stream().allMatch(Check::passed);
  }

  public List<Check> failures() {
    return checks.stream().filter(c -> !c.passed()).toList();
  }
}

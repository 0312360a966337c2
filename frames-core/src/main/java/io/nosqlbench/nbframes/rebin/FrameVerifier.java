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

import io.nosqlbench.nbframes.classify.ClassifiedFrame;
import io.nosqlbench.nbframes.classify.FrameClassifier;
import io.nosqlbench.nbframes.classify.FramePlan;
import io.nosqlbench.nbframes.frame.FrameArrays;
import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.geometry.ChannelMap;
import io.nosqlbench.nbframes.geometry.PlaneChannels;
import io.nosqlbench.nbframes.io.FrameSource;
import io.nosqlbench.nbframes.reduce.RebinFactors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Checks a rebinned frame set against the raw frames it was made from.
///
/// For every continuous frame type and every (group, plane), the rebinned array
/// must exist, have the reduced shape, and sum to the raw sum over the plane's
/// channels within a relative tolerance. For every label family, each ranked
/// weight cell must satisfy `weight_1st >= weight_2nd >= 0`.
public class FrameVerifier {
  private static final Logger logger = LogManager.getLogger(FrameVerifier.class);

  private final RebinConfig config;
  private final ChannelMap channelMap;
  private final double tolerance;

  /// @param config the configuration the rebinned set was produced with
  /// @param tolerance the allowed relative difference between sums
  public FrameVerifier(RebinConfig config, double tolerance) {
    if (!(tolerance >= 0.0d)) {
      throw new IllegalArgumentException("tolerance must be non-negative: " + tolerance);
    }
    this.config = config;
    this.channelMap = ChannelMap.build(config.layout());
    this.tolerance = tolerance;
  }

  /// @param raw the raw frames
  /// @param rebinned the rebinned frames
  /// @return every check made
  public VerificationReport verify(FrameSource raw, FrameSource rebinned) {
    FramePlan plan = new FrameClassifier(config.naming(), config.unknownPolicy()).plan(raw.names());
    OutputNaming naming = config.outputNaming();
    RebinFactors factors = config.factors();
    List<VerificationReport.Check> checks = new ArrayList<>();

    for (ClassifiedFrame frame : plan.continuous()) {
      double[][] values = raw.readContinuous(frame.datasetName()).values();
      for (PlaneChannels unit : channelMap.planes()) {
        String name = naming.continuous(unit.group(), unit.plane(), frame.frameType());
        double expected = 0.0d;
        for (int ch : unit.channels()) {
          for (double v : values[ch]) {
            expected += v;
          }
        }
        if (!rebinned.contains(name)) {
          checks.add(new VerificationReport.Check(name, expected, Double.NaN, false,
              "missing from rebinned set"));
          continue;
        }
        FrameShape reduced = factors.reducedShape(
            new FrameShape(unit.size(), values.length == 0 ? 0 : values[0].length));
        FrameShape found = rebinned.shape(name);
        if (!reduced.equals(found)) {
          checks.add(new VerificationReport.Check(name, expected, Double.NaN, false,
              "shape " + found + " differs from expected " + reduced));
          continue;
        }
        double actual = 0.0d;
        for (double[] row : rebinned.readContinuous(name).values()) {
          for (double v : row) {
            actual += v;
          }
        }
        boolean ok = withinTolerance(expected, actual);
        checks.add(new VerificationReport.Check(name, expected, actual, ok,
            ok ? "sum conserved" : "sum differs by " + Math.abs(expected - actual)));
      }
    }

    for (FramePlan.LabelFamily family : plan.families()) {
      for (PlaneChannels unit : channelMap.planes()) {
        checks.add(checkWeightOrder(rebinned,
            naming.weight(unit.group(), unit.plane(), family.family(), OutputNaming.FIRST),
            naming.weight(unit.group(), unit.plane(), family.family(), OutputNaming.SECOND)));
      }
    }

    long failed = checks.stream().filter(c -> !c.passed()).count();
    logger.info("verified {} rebinned arrays, {} failed", checks.size(), failed);
    return new VerificationReport(checks);
  }

  private VerificationReport.Check checkWeightOrder(FrameSource rebinned, String first,
                                                    String second)
  {
    if (!rebinned.contains(first) || !rebinned.contains(second)) {
      return new VerificationReport.Check(first, Double.NaN, Double.NaN, false,
          "missing ranked weights " + first + " or " + second);
    }
    double[][] w1 = FrameArrays.toDoubles(rebinned.readArray(first), first);
    double[][] w2 = FrameArrays.toDoubles(rebinned.readArray(second), second);
    if (!FrameArrays.shapeOf(w1, first).equals(FrameArrays.shapeOf(w2, second))) {
      return new VerificationReport.Check(first, Double.NaN, Double.NaN, false,
          "ranked weight shapes differ");
    }
    for (int r = 0; r < w1.length; r++) {
      for (int c = 0; c < w1[r].length; c++) {
        if (!(w1[r][c] >= w2[r][c] && w2[r][c] >= 0.0d)) {
          return new VerificationReport.Check(first, w1[r][c], w2[r][c], false,
              "weight order violated at [" + r + "," + c + "]");
        }
      }
    }
    return new VerificationReport.Check(first, Double.NaN, Double.NaN, true, "weights ordered");
  }

  private boolean withinTolerance(double expected, double actual) {
    double scale = Math.max(Math.abs(expected), Math.abs(actual));
    return Math.abs(expected - actual) <= tolerance * Math.max(scale, 1.0d);
  }
}

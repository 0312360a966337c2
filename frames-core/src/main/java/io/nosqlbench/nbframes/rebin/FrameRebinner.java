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

import io.nosqlbench.nbframes.RebinException;
import io.nosqlbench.nbframes.classify.ClassifiedFrame;
import io.nosqlbench.nbframes.classify.FrameClassifier;
import io.nosqlbench.nbframes.classify.FramePlan;
import io.nosqlbench.nbframes.frame.FrameShape;
import io.nosqlbench.nbframes.frame.RebinnedArray;
import io.nosqlbench.nbframes.geometry.ChannelMap;
import io.nosqlbench.nbframes.geometry.PlaneChannels;
import io.nosqlbench.nbframes.io.FrameSink;
import io.nosqlbench.nbframes.io.FrameSource;
import io.nosqlbench.nbframes.reduce.BlockReducer;
import io.nosqlbench.nbframes.reduce.LabelLayer;
import io.nosqlbench.nbframes.reduce.RankAggregator;
import io.nosqlbench.nbframes.reduce.RankedBlocks;
import io.nosqlbench.nbframes.reduce.RebinFactors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Rebins every classified frame of a source, per (group, plane), into a sink.
///
/// A run goes through these phases, and nothing reaches the sink before the last:
/// 1. classify the source's dataset names into a [FramePlan]
/// 2. check that every participating frame has the shape
///    (layout total channels, common tick count)
/// 3. read each participating dataset once
/// 4. reduce every (group, plane) unit, sequentially or on a fixed pool
/// 5. stage all outputs in (group, plane, frame) order and commit
///
/// Any failure aborts the sink and propagates. The channel map is built once per
/// rebinner, so one instance can be reused across sources and runs.
public class FrameRebinner {
  private static final Logger logger = LogManager.getLogger(FrameRebinner.class);

  private final RebinConfig config;
  private final FrameClassifier classifier;
  private final ChannelMap channelMap;
  private final OutputNaming outputNaming;

  /// @param config the run configuration
  public FrameRebinner(RebinConfig config) {
    this.config = config;
    this.classifier = new FrameClassifier(config.naming(), config.unknownPolicy());
    this.channelMap = ChannelMap.build(config.layout());
    this.outputNaming = config.outputNaming();
  }

  public RebinConfig config() {
    return config;
  }

  public ChannelMap channelMap() {
    return channelMap;
  }

  /// rebin all frames of a source and commit them to a sink
  /// @param source the raw frames, which are not modified
  /// @param sink receives every output, committed at the end of a successful run
  /// @return what was produced
  /// @throws RebinException on any failure, after aborting the sink
  public RebinSummary rebin(FrameSource source, FrameSink sink) {
    long started = System.currentTimeMillis();
    try {
      FramePlan plan = classifier.plan(source.names());
      if (plan.isEmpty()) {
        logger.warn("no rebinnable frames among {} datasets", source.names().size());
      }
      FrameShape shape = validateShapes(source, plan);
      Inputs inputs = readInputs(source, plan);

      List<List<RebinnedArray>> results = runUnits(plan, inputs);
      List<String> outputNames = new ArrayList<>();
      for (List<RebinnedArray> unitResults : results) {
        for (RebinnedArray array : unitResults) {
          sink.put(array);
          outputNames.add(array.name());
        }
      }
      sink.commit();

      long elapsed = System.currentTimeMillis() - started;
      logger.info("rebinned {} frame types over {} units into {} arrays with {} blocks in {} ms",
          plan.continuous().size() + plan.families().size(), channelMap.planes().size(),
          outputNames.size(), config.factors(), elapsed);
      return new RebinSummary(
          config.factors(),
          shape,
          plan.continuous().stream().map(ClassifiedFrame::frameType).toList(),
          plan.families().stream().map(FramePlan.LabelFamily::family).toList(),
          plan.skipped(),
          channelMap.planes().size(),
          outputNames,
          elapsed);
    } catch (RuntimeException e) {
      logger.debug("aborting sink after failure: {}", e.getMessage());
      sink.abort();
      throw e;
    }
  }

  private FrameShape validateShapes(FrameSource source, FramePlan plan) {
    int totalChannels = config.layout().totalChannels();
    String first = null;
    FrameShape expected = null;
    for (String name : plan.participatingDatasets()) {
      FrameShape shape = source.shape(name);
      if (shape.channels() != totalChannels) {
        throw new ShapeMismatchException(name, new FrameShape(totalChannels, shape.ticks()), shape,
            "a layout with " + totalChannels + " channels");
      }
      if (expected == null) {
        expected = shape;
        first = name;
      } else if (!expected.equals(shape)) {
        throw new ShapeMismatchException(name, expected, shape, "dataset '" + first + "'");
      }
    }
    return expected;
  }

  private Inputs readInputs(FrameSource source, FramePlan plan) {
    Map<String, double[][]> values = new HashMap<>();
    Map<String, int[][]> labels = new HashMap<>();
    for (ClassifiedFrame frame : plan.continuous()) {
      values.computeIfAbsent(frame.datasetName(), n -> source.readContinuous(n).values());
    }
    for (FramePlan.LabelFamily family : plan.families()) {
      for (FramePlan.LayerRef ref : family.layers()) {
        labels.computeIfAbsent(ref.labelDataset(), n -> source.readLabels(n).labels());
        values.computeIfAbsent(ref.weightDataset(), n -> source.readContinuous(n).values());
      }
    }
    logger.debug("read {} value datasets and {} label datasets", values.size(), labels.size());
    return new Inputs(values, labels);
  }

  private List<List<RebinnedArray>> runUnits(FramePlan plan, Inputs inputs) {
    List<PlaneChannels> units = channelMap.planes();
    List<List<RebinnedArray>> results = new ArrayList<>(units.size());
    int threads = Math.min(config.threads(), units.size());
    if (threads <= 1) {
      for (PlaneChannels unit : units) {
        results.add(rebinUnit(unit, plan, inputs));
      }
      return results;
    }

    ExecutorService executor = Executors.newFixedThreadPool(threads, new ThreadFactory() {
      private final AtomicInteger counter = new AtomicInteger(0);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, "rebin-worker-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
      }
    });
    try {
      List<Future<List<RebinnedArray>>> futures = new ArrayList<>(units.size());
      for (PlaneChannels unit : units) {
        futures.add(executor.submit(() -> rebinUnit(unit, plan, inputs)));
      }
      for (int i = 0; i < futures.size(); i++) {
        try {
          results.add(futures.get(i).get());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new RebinException("interrupted while rebinning " + units.get(i).label(), e);
        } catch (ExecutionException e) {
          if (e.getCause() instanceof RuntimeException re) {
            throw re;
          }
          throw new RebinException("failed to rebin " + units.get(i).label(), e.getCause());
        }
      }
      return results;
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
          logger.warn("rebin workers did not terminate within 60 seconds");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private List<RebinnedArray> rebinUnit(PlaneChannels unit, FramePlan plan, Inputs inputs) {
    RebinFactors factors = config.factors();
    int g = unit.group();
    int p = unit.plane();
    List<RebinnedArray> out = new ArrayList<>();

    for (ClassifiedFrame frame : plan.continuous()) {
      double[][] slice = sliceRows(inputs.values().get(frame.datasetName()), unit.channels());
      out.add(RebinnedArray.ofDoubles(outputNaming.continuous(g, p, frame.frameType()),
          BlockReducer.sum(slice, factors)));
    }

    for (FramePlan.LabelFamily family : plan.families()) {
      List<LabelLayer> layers = new ArrayList<>(family.layers().size());
      for (FramePlan.LayerRef ref : family.layers()) {
        layers.add(new LabelLayer(
            sliceRows(inputs.labels().get(ref.labelDataset()), unit.channels()),
            sliceRows(inputs.values().get(ref.weightDataset()), unit.channels())));
      }
      RankedBlocks ranked = RankAggregator.aggregate(layers, factors);
      String name = family.family();
      out.add(RebinnedArray.ofInts(
          outputNaming.label(g, p, name, OutputNaming.FIRST), ranked.label1st()));
      out.add(RebinnedArray.ofInts(
          outputNaming.label(g, p, name, OutputNaming.SECOND), ranked.label2nd()));
      out.add(RebinnedArray.ofDoubles(
          outputNaming.weight(g, p, name, OutputNaming.FIRST), ranked.weight1st()));
      out.add(RebinnedArray.ofDoubles(
          outputNaming.weight(g, p, name, OutputNaming.SECOND), ranked.weight2nd()));
    }
    logger.debug("{}: {} outputs", unit.label(), out.size());
    return out;
  }

  private static double[][] sliceRows(double[][] rows, int[] channels) {
    double[][] slice = new double[channels.length][];
    for (int i = 0; i < channels.length; i++) {
      slice[i] = rows[channels[i]];
    }
    return slice;
  }

  private static int[][] sliceRows(int[][] rows, int[] channels) {
    int[][] slice = new int[channels.length][];
    for (int i = 0; i < channels.length; i++) {
      slice[i] = rows[channels[i]];
    }
    return slice;
  }

  private record Inputs(Map<String, double[][]> values, Map<String, int[][]> labels) {
  }
}

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

package io.nosqlbench.nbframes.command.subcommands;

import io.nosqlbench.nbframes.RebinException;
import io.nosqlbench.nbframes.command.common.LayoutOption;
import io.nosqlbench.nbframes.geometry.ChannelLocation;
import io.nosqlbench.nbframes.geometry.DetectorLayout;
import io.nosqlbench.nbframes.geometry.GeometryResolver;
import io.nosqlbench.nbframes.geometry.PlaneRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Resolve channel numbers to readout group, plane and plane-local index.
///
/// Without channel arguments, or with `--table`, the channel ranges of every group
/// and plane of the layout are printed.
@CommandLine.Command(
    name = "locate",
    header = "Map channels to readout groups and planes",
    description = "Resolves global channel numbers against the detector layout.",
    exitCodeList = {
        "0: Success",
        "1: A channel is outside the layout, or the layout is invalid",
        "2: Invalid options"
    }
)
public class CMD_nbframes_locate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_nbframes_locate.class);

    @CommandLine.Mixin
    private LayoutOption layoutOption = new LayoutOption();

    @CommandLine.Parameters(arity = "0..*", description = "Global channel numbers")
    private List<Integer> channels = new ArrayList<>();

    @CommandLine.Option(names = {"--table", "-t"}, description = "Print the layout table")
    private boolean table = false;

    @Override
    public Integer call() {
        try {
            layoutOption.validate();
        } catch (IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
        try {
            DetectorLayout layout = layoutOption.getLayout();
            if (table || channels.isEmpty()) {
                printTable(layout);
            }
            GeometryResolver resolver = new GeometryResolver(layout);
            for (int channel : channels) {
                ChannelLocation loc = resolver.resolve(channel);
                System.out.printf("channel %d -> group %d plane %d (%s) local %d%n",
                    channel, loc.group(), loc.plane(), layout.planeName(loc.plane()), loc.local());
            }
            return 0;
        } catch (RebinException e) {
            logger.debug("unable to locate channels", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printTable(DetectorLayout layout) {
        System.out.printf("%d units x %d channels, %d groups, planes %s%n",
            layout.units(), layout.channelsPerUnit(), layout.groupCount(), layout.planeNames());
        for (int g = 0; g < layout.groupCount(); g++) {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("  group %d:", g));
            for (int p = 0; p < layout.planeCount(); p++) {
                PlaneRange range = layout.range(g, p);
                sb.append(String.format("  %s %-14s", layout.planeName(p), range));
            }
            System.out.println(sb.toString().stripTrailing());
        }
    }
}

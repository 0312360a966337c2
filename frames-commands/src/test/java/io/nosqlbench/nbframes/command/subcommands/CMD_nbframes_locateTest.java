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

import io.nosqlbench.nbframes.command.FrameFileFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_nbframes_locateTest {

    @Test
    void testLocateProtoDuneChannels() {
        FrameFileFixtures.Result result = FrameFileFixtures.run("locate", "0", "1500", "3071", "3072");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.output())
            .contains("channel 0 -> group 0 plane 0 (U) local 0")
            .contains("channel 1500 -> group 1 plane 1 (V) local 72")
            .contains("channel 3071 -> group 1 plane 2 (W) local 583")
            .contains("channel 3072 -> group 2 plane 0 (U) local 0")
            .doesNotContain("units x");
    }

    @Test
    void testChannelOutsideLayout() {
        FrameFileFixtures.Result result = FrameFileFixtures.run("locate", "12288");
        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void testTableForLayoutFile(@TempDir Path tempDir) throws Exception {
        Path layout = FrameFileFixtures.writeLayout(tempDir);

        FrameFileFixtures.Result result =
            FrameFileFixtures.run("locate", "--layout", layout.toString(), "5");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.output()).contains("channel 5 -> group 1 plane 1 (W) local 0");

        FrameFileFixtures.Result table = FrameFileFixtures.run("locate", "--layout", layout.toString());
        assertThat(table.exitCode()).isEqualTo(0);
        assertThat(table.output())
            .contains("2 units x 6 channels, 4 groups, planes [U, W]")
            .contains("group 3:");
    }

    @Test
    void testMissingLayoutFile(@TempDir Path tempDir) {
        FrameFileFixtures.Result result = FrameFileFixtures.run(
            "locate", "--layout", tempDir.resolve("missing.yaml").toString(), "1");
        assertThat(result.exitCode()).isEqualTo(2);
    }
}

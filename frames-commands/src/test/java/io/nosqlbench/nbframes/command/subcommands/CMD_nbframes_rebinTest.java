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

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.nosqlbench.nbframes.command.FrameFileFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_nbframes_rebinTest {

    @TempDir
    Path tempDir;

    private Path rec;
    private Path tru;
    private Path layout;

    @BeforeEach
    void writeInputs() throws Exception {
        rec = FrameFileFixtures.writeRec(tempDir, FrameFileFixtures.TICKS);
        tru = FrameFileFixtures.writeTru(tempDir);
        layout = FrameFileFixtures.writeLayout(tempDir);
    }

    @Test
    void testRebinWritesAllPlanes() {
        Path out = tempDir.resolve("rebinned.h5");

        FrameFileFixtures.Result result = FrameFileFixtures.run("rebin",
            "-i", rec.toString(), "-i", tru.toString(),
            "-o", out.toString(), "--layout", layout.toString());

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.output())
            .contains("Rebinned frames of shape")
            .contains("Wrote 56 datasets for 8 planes");
        assertThat(out).exists();

        try (HdfFile hdf = new HdfFile(out)) {
            assertThat(hdf.getChildren()).hasSize(56);
            Dataset gauss = (Dataset) hdf.getByPath("frame_group0_plane0_gauss");
            assertThat(gauss.getDimensions()).containsExactly(1, 4);
            assertThat(hdf.getChildren()).containsKeys(
                "frame_group3_plane1_orig_trackid_1st",
                "frame_group3_plane1_orig_trackid_weight_2nd",
                "frame_group2_plane0_charge_1st");
            assertThat(hdf.getAttributes()).containsKeys("rebin_channel", "rebin_time", "layout");
        }
    }

    @Test
    void testRebinFactorsAndPrefix() {
        Path out = tempDir.resolve("rebinned.h5");

        int exitCode = FrameFileFixtures.run("rebin",
            "-i", rec.toString() + ":/1", "-i", tru.toString(),
            "-o", out.toString(), "--layout", layout.toString(),
            "--rebin", "1x4", "--prefix", "rb_", "--threads", "3").exitCode();

        assertThat(exitCode).isEqualTo(0);
        try (HdfFile hdf = new HdfFile(out)) {
            Dataset gauss = (Dataset) hdf.getByPath("rb_group1_plane0_gauss");
            assertThat(gauss.getDimensions()).containsExactly(2, 2);
            assertThat(hdf.getChildren().keySet()).allMatch(name -> name.startsWith("rb_"));
        }
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        Path out = Files.writeString(tempDir.resolve("rebinned.h5"), "keep");

        int exitCode = FrameFileFixtures.run("rebin",
            "-i", rec.toString(), "-i", tru.toString(),
            "-o", out.toString(), "--layout", layout.toString()).exitCode();

        assertThat(exitCode).isEqualTo(2);
        assertThat(Files.readString(out)).isEqualTo("keep");

        int forced = FrameFileFixtures.run("rebin",
            "-i", rec.toString(), "-i", tru.toString(),
            "-o", out.toString(), "--layout", layout.toString(), "--force").exitCode();
        assertThat(forced).isEqualTo(0);
    }

    @Test
    void testShapeMismatchWritesNothing() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("mismatch"));
        Path shortRec = FrameFileFixtures.writeRec(dir, FrameFileFixtures.TICKS + 2);
        Path out = tempDir.resolve("rebinned.h5");

        int exitCode = FrameFileFixtures.run("rebin",
            "-i", shortRec.toString(), "-i", tru.toString(),
            "-o", out.toString(), "--layout", layout.toString()).exitCode();

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void testChannelCountMustMatchLayout() {
        Path out = tempDir.resolve("rebinned.h5");

        // the built-in layout needs 12288 channels
        int exitCode = FrameFileFixtures.run("rebin",
            "-i", rec.toString(), "-i", tru.toString(), "-o", out.toString()).exitCode();

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void testMissingInputFile() {
        int exitCode = FrameFileFixtures.run("rebin",
            "-i", tempDir.resolve("absent.h5").toString(),
            "-o", tempDir.resolve("rebinned.h5").toString()).exitCode();

        assertThat(exitCode).isEqualTo(2);
    }
}

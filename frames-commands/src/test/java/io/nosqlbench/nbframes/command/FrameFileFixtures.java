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

package io.nosqlbench.nbframes.command;

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableGroup;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Writes small raw frame files over a 12 channel layout.
public final class FrameFileFixtures {

    public static final int CHANNELS = 12;
    public static final int TICKS = 8;

    public static final String LAYOUT_YAML = """
        units: 2
        channels_per_unit: 6
        planes: [U, W]
        halves:
          - {U: [0, 2], W: [4, 5]}
          - {U: [2, 4], W: [5, 6]}
        """;

    private FrameFileFixtures() {
    }

    public static Path writeLayout(Path dir) throws IOException {
        return Files.writeString(dir.resolve("layout.yaml"), LAYOUT_YAML);
    }

    public static Path writeRec(Path dir, int ticks) {
        Path rec = dir.resolve("g4-rec.h5");
        float[][] gauss = new float[CHANNELS][ticks];
        for (int r = 0; r < CHANNELS; r++) {
            for (int c = 0; c < ticks; c++) {
                gauss[r][c] = r + c / 10.0f;
            }
        }
        try (WritableHdfFile writable = HdfFile.write(rec)) {
            WritableGroup event = writable.putGroup("1");
            event.putDataset("frame_gauss", gauss);
        }
        return rec;
    }

    public static Path writeTru(Path dir) {
        Path tru = dir.resolve("g4-tru.h5");
        float[][] charge1 = new float[CHANNELS][TICKS];
        float[][] charge2 = new float[CHANNELS][TICKS];
        int[][] track1 = new int[CHANNELS][TICKS];
        int[][] track2 = new int[CHANNELS][TICKS];
        for (int r = 0; r < CHANNELS; r++) {
            for (int c = 0; c < TICKS; c++) {
                charge1[r][c] = (r + c) % 4;
                charge2[r][c] = (r * c) % 3;
                track1[r][c] = 1 + (r + c) % 2;
                track2[r][c] = 3;
            }
        }
        try (WritableHdfFile writable = HdfFile.write(tru)) {
            WritableGroup event = writable.putGroup("1");
            event.putDataset("frame_charge_1st", charge1);
            event.putDataset("frame_charge_2nd", charge2);
            event.putDataset("frame_orig_trackid_1st", track1);
            event.putDataset("frame_orig_trackid_2nd", track2);
        }
        return tru;
    }

    /// run nbframes with the given arguments, capturing stdout
    public static Result run(String... args) {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent));
        try {
            int exitCode = CMD_nbframes.commandLine().execute(args);
            return new Result(exitCode, outContent.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    public record Result(int exitCode, String output) {
    }
}

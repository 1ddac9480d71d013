/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.proclog.buffer;

import dev.mars.proclog.config.ProcLogConfig;
import dev.mars.proclog.writer.RecordingLogWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The lines produced from a stream must not depend on how it was cut into chunks.
 * <p>
 * Each test feeds the same output once as a single chunk and once in pieces,
 * then compares what reached the writer and what is in the live view.
 */
class ChunkBoundaryTest {

    private static final String ESC = "\u001B";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-31T12:00:00Z"), ZoneOffset.UTC);

    /** Mixed line endings, colors, OSC title, empty lines and non-ASCII text. */
    private static final String OUTPUT =
            "starting server\r\n"
                    + ESC + "[32mINFO" + ESC + "[0m listening on :8080\n"
                    + "progress 10%\rprogress 50%\rprogress 100%\n"
                    + "\n"
                    + ESC + "]0;server" + "\u0007" + "title set\r\n"
                    + ESC + "[1;31mERROR" + ESC + "[0m café unreachable\r\n"
                    + "\r\n"
                    + "tail without newline";

    @TempDir
    Path tempDir;

    private ProcLogConfig config;

    @BeforeEach
    void setUp() {
        config = ProcLogConfig.builder().logsDir(tempDir).maxLogLines(100).build();
    }

    private Captured feedWhole() {
        RecordingLogWriter writer = new RecordingLogWriter();
        LogBuffer buffer = new LogBuffer("whole", config, writer, CLOCK);
        buffer.append(OUTPUT);
        buffer.flushPartial();
        return new Captured(writer.textFor(buffer.file()), buffer.getRecent(), buffer.size());
    }

    private Captured feedChunked(int[] cuts) {
        RecordingLogWriter writer = new RecordingLogWriter();
        LogBuffer buffer = new LogBuffer("chunked", config, writer, CLOCK);
        int from = 0;
        for (int cut : cuts) {
            buffer.append(OUTPUT.substring(from, cut));
            from = cut;
        }
        buffer.append(OUTPUT.substring(from));
        buffer.flushPartial();
        return new Captured(writer.textFor(buffer.file()), buffer.getRecent(), buffer.size());
    }

    private record Captured(String fileText, String recent, int lines) {
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 7, 16, 64, 1000})
    @DisplayName("Fixed-size chunks give the same lines as one chunk")
    void testFixedChunkSizes(int size) {
        int count = (OUTPUT.length() - 1) / size;
        int[] cuts = new int[count];
        for (int i = 0; i < count; i++) {
            cuts[i] = (i + 1) * size;
        }

        Captured whole = feedWhole();
        Captured chunked = feedChunked(cuts);

        assertEquals(whole.fileText(), chunked.fileText());
        assertEquals(whole.recent(), chunked.recent());
        assertEquals(whole.lines(), chunked.lines());
    }

    @RepeatedTest(25)
    @DisplayName("Random chunk boundaries give the same lines as one chunk")
    void testRandomChunks(RepetitionInfo info) {
        Random random = new Random(31L * info.getCurrentRepetition());
        int[] cuts = random.ints(random.nextInt(20) + 1, 1, OUTPUT.length())
                .sorted()
                .distinct()
                .toArray();

        Captured whole = feedWhole();
        Captured chunked = feedChunked(cuts);

        assertEquals(whole.fileText(), chunked.fileText(), "cuts differ from single chunk");
        assertEquals(whole.recent(), chunked.recent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\r\n", "\r", "\n"})
    @DisplayName("Every line-ending style yields the same line count")
    void testLineEndingStyles(String ending) {
        RecordingLogWriter writer = new RecordingLogWriter();
        LogBuffer buffer = new LogBuffer("endings", config, writer, CLOCK);

        for (int i = 0; i < 5; i++) {
            for (char c : ("line-" + i + ending).toCharArray()) {
                buffer.append(String.valueOf(c));
            }
        }
        buffer.flushPartial();

        assertEquals(5, buffer.size());
    }

    @Test
    @DisplayName("Whole-stream line count matches the newline count")
    void testLineCount() {
        Captured whole = feedWhole();

        // 9 line breaks (two bare CRs in the progress line) plus the flushed tail
        assertEquals(10, whole.lines());
        assertEquals(10, whole.fileText().split("\n", -1).length - 1);
    }
}

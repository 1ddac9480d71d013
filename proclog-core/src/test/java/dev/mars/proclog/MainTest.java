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
package dev.mars.proclog;

import dev.mars.proclog.buffer.LogBuffer;
import dev.mars.proclog.config.ProcLogConfig;
import dev.mars.proclog.writer.RecordingLogWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-31T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("pump echoes display lines and flushes the unterminated tail")
    void testPump() throws IOException {
        RecordingLogWriter writer = new RecordingLogWriter();
        ProcLogConfig config = ProcLogConfig.builder().logsDir(tempDir).build();
        LogBuffer buffer = new LogBuffer("stdin", config, writer, CLOCK);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            Main.pump(new ByteArrayInputStream("one\r\n\u001B[33mtwo\u001B[0m\nthree".getBytes(StandardCharsets.UTF_8)),
                    buffer, out);
        }

        assertEquals("[2026-01-31 12:00:00] one\n"
                        + "[2026-01-31 12:00:00] two\n"
                        + "[2026-01-31 12:00:00] three\n",
                writer.textFor(buffer.file()));
        String echoed = bytes.toString(StandardCharsets.UTF_8);
        assertEquals(3, echoed.split("\n").length);
        assertTrue(echoed.contains("\u001B[33mtwo\u001B[0m"));
        assertEquals(0, buffer.partialLength());
    }

    @Test
    @DisplayName("pump of empty input produces nothing")
    void testPumpEmpty() throws IOException {
        RecordingLogWriter writer = new RecordingLogWriter();
        LogBuffer buffer = new LogBuffer("stdin", ProcLogConfig.builder().logsDir(tempDir).build(), writer, CLOCK);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        Main.pump(new ByteArrayInputStream(new byte[0]), buffer, new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertEquals(0, bytes.size());
        assertTrue(writer.writes().isEmpty());
    }
}

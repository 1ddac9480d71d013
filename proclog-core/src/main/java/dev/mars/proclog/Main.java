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

import dev.mars.proclog.buffer.AppendResult;
import dev.mars.proclog.buffer.LogBuffer;
import dev.mars.proclog.buffer.LogBufferManager;
import dev.mars.proclog.config.ProcLogConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Tails standard input into a log buffer.
 * <p>
 * Reads stdin in raw chunks, echoes the timestamped display rendering to stdout
 * and persists every line to {@code <logsDir>/<stream>.log}:
 * <pre>
 * ./server 2&gt;&amp;1 | java -cp proclog-core.jar dev.mars.proclog.Main server [logsDir]
 * </pre>
 */
public class Main {

    public static void main(String[] args) throws Exception {
        if (args.length < 1 || args[0].isBlank()) {
            System.err.println("Usage: Main <stream-name> [logsDir]");
            System.exit(2);
        }

        ProcLogConfig config = args.length > 1 && !args[1].isBlank()
                ? ProcLogConfig.builder().logsDir(args[1]).build()
                : ProcLogConfig.load();

        PrintStream out = System.out;
        try (LogBufferManager logs = new LogBufferManager(config)) {
            LogBuffer buffer = logs.buffer(args[0]);
            pump(System.in, buffer, out);

            // Let the writer catch up so the summary reflects the file
            logs.writer().awaitIdle(config.closeTimeout());
            System.err.printf("%n%s: %d lines in %s, %d chunks dropped%n",
                    buffer.name(), buffer.lineCount(), buffer.file().toAbsolutePath(),
                    logs.writer().droppedCount());
        }
    }

    static void pump(InputStream in, LogBuffer buffer, PrintStream out) throws IOException {
        // The reader decodes leniently: malformed bytes become U+FFFD
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        char[] chunk = new char[8192];
        int n;
        while ((n = reader.read(chunk)) != -1) {
            AppendResult result = buffer.append(new String(chunk, 0, n));
            out.print(result.displayText());
        }
        out.print(buffer.flushPartial().displayText());
        out.flush();
    }
}

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
package dev.mars.proclog.demo;

import dev.mars.proclog.buffer.ChunkResult;
import dev.mars.proclog.buffer.LogBuffer;
import dev.mars.proclog.buffer.LogBufferManager;
import dev.mars.proclog.buffer.SearchResult;
import dev.mars.proclog.config.ProcLogConfig;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Demo: captures the output of a child process into a log buffer.
 * <p>
 * This demonstrates the full ingestion and read path:
 * <ul>
 *   <li>Spawning a process and feeding its output in randomly sized chunks</li>
 *   <li>Partial lines, CRLF and color codes surviving arbitrary chunk boundaries</li>
 *   <li>Completing the trailing fragment when the process exits</li>
 *   <li>Paging the persisted history backwards</li>
 *   <li>Searching the history</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link ProcLogConfig}: system properties
 * ({@code -Dproclog.logsDir=/path}), environment variables ({@code PROCLOG_LOGS_DIR}),
 * {@code proclog.properties}, then defaults. Without an explicit log directory the
 * demo writes to a temporary one.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl proclog-demo -am
 *
 * # Run the built-in noisy script
 * java -jar proclog-demo/target/proclog-demo-1.0-SNAPSHOT.jar
 *
 * # Capture any command
 * java -jar proclog-demo/target/proclog-demo-1.0-SNAPSHOT.jar ping -c 5 localhost
 * </pre>
 */
public class ProcessLogDemo {

    private static final String STREAM = "demo";
    private static final int PAGE_SIZE = 10;

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Process Log Capture Demo       |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        ProcLogConfig config = explicitLogsDir()
                ? ProcLogConfig.load()
                : ProcLogConfig.builder().logsDir(Files.createTempDirectory("proclog-demo-")).build();
        System.out.println("Configuration: " + config);
        System.out.println();

        List<String> command = args.length > 0 ? Arrays.asList(args) : defaultCommand();

        try (LogBufferManager logs = new LogBufferManager(config)) {
            LogBuffer buffer = logs.buffer(STREAM);
            buffer.clear();

            int exitCode = capture(command, buffer);
            System.out.println("[OK] Process exited with code " + exitCode);

            logs.writer().awaitIdle(config.closeTimeout());
            System.out.println("[OK] " + buffer.lineCount() + " lines persisted to " + buffer.file());

            System.out.println("\n  Live view (last " + buffer.size() + " lines in memory):");
            System.out.print(indent(buffer.getRecent()));

            System.out.println("\n  History, newest page first:");
            int end = buffer.lineCount();
            int page = 1;
            while (end > 0) {
                ChunkResult chunk = buffer.loadChunk(end, PAGE_SIZE);
                System.out.printf("  -- page %d: lines %d-%d --%n", page++, chunk.start(), end - 1);
                System.out.print(indent(chunk.text()));
                end = chunk.start();
            }

            SearchResult errors = buffer.search("error");
            System.out.println("\n  Search 'error': " + errors.matchCount() + " matches");
            System.out.print(indent(errors.text()));

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("+---------------------------------------+");
        }
    }

    /**
     * Runs {@code command} and feeds its merged output into {@code buffer} in
     * chunks of 1 to 64 characters.
     */
    static int capture(List<String> command, LogBuffer buffer) throws IOException, InterruptedException {
        System.out.println("[..] Running: " + String.join(" ", command));
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();

        ThreadLocalRandom random = ThreadLocalRandom.current();
        char[] chunk = new char[64];
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(chunk, 0, random.nextInt(1, chunk.length + 1))) != -1) {
                buffer.append(new String(chunk, 0, n));
            }
        }
        buffer.flushPartial();
        return process.waitFor();
    }

    private static List<String> defaultCommand() {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return List.of("cmd", "/c",
                    "for /L %i in (1,1,25) do @(echo INFO tick %i & if %i==7 echo ERROR failed at %i)");
        }
        return List.of("sh", "-c",
                "for i in $(seq 1 25); do "
                        + "printf '\\033[32mINFO\\033[0m tick %d\\r\\n' $i; "
                        + "if [ $((i % 7)) -eq 0 ]; then printf 'ERROR failed at %d\\n' $i; fi; "
                        + "done; printf 'exiting without newline'");
    }

    private static boolean explicitLogsDir() {
        return System.getProperty("proclog.logsDir") != null || System.getenv("PROCLOG_LOGS_DIR") != null;
    }

    private static String indent(String text) {
        return text.isEmpty() ? "" : text.replaceAll("(?m)^", "    ");
    }
}

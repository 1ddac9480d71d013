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

import dev.mars.proclog.buffer.LogBuffer;
import dev.mars.proclog.buffer.LogBufferManager;
import dev.mars.proclog.config.ProcLogConfig;
import dev.mars.proclog.writer.AsyncFileWriter;
import dev.mars.proclog.writer.FileAppender;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Floods a deliberately slow writer from many producer threads.
 * <p>
 * Each stream gets its own producer thread that appends one line per call as
 * fast as it can. The writer's queue is small and every disk write is delayed,
 * so chunks are dropped. Afterwards the run checks that:
 * <ul>
 *   <li>No producer call ever blocked for long</li>
 *   <li>Lines on disk plus dropped chunks account for every line appended</li>
 *   <li>The drop annotations in the files add up to the writer's drop count</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl proclog-demo -am
 *
 * # 8 streams x 2000 lines (defaults)
 * java -cp proclog-demo/target/proclog-demo-1.0-SNAPSHOT.jar dev.mars.proclog.demo.BackpressureChaos
 *
 * # 16 streams x 10000 lines
 * java -cp proclog-demo/target/proclog-demo-1.0-SNAPSHOT.jar dev.mars.proclog.demo.BackpressureChaos 16 10000
 * </pre>
 */
public class BackpressureChaos {

    private static final Pattern DROP_NOTICE = Pattern.compile("^\\[log-writer] dropped (\\d+) chunks due to backpressure$");
    private static final int QUEUE_CAPACITY = 64;
    private static final long DISK_DELAY_MICROS = 200;

    public static void main(String[] args) throws Exception {
        int streams = args.length > 0 ? Integer.parseInt(args[0]) : 8;
        int linesPerStream = args.length > 1 ? Integer.parseInt(args[1]) : 2000;

        System.out.println("+---------------------------------------------------+");
        System.out.println("|            WRITER BACKPRESSURE CHAOS              |");
        System.out.println("+---------------------------------------------------+");
        System.out.printf("streams=%d, linesPerStream=%d, queueCapacity=%d, diskDelay=%d us%n%n",
                streams, linesPerStream, QUEUE_CAPACITY, DISK_DELAY_MICROS);

        Path dir = Files.createTempDirectory("proclog-chaos-");
        ProcLogConfig config = ProcLogConfig.builder()
                .logsDir(dir)
                .writerQueueCapacity(QUEUE_CAPACITY)
                .writerPollInterval(Duration.ofMillis(20))
                .closeTimeout(Duration.ofSeconds(30))
                .build();

        FileAppender slowDisk = slow(FileAppender.nio());
        boolean passed;
        try (LogBufferManager logs = new LogBufferManager(config,
                c -> new AsyncFileWriter(c.writerQueueCapacity(), c.writerPollInterval(), c.closeTimeout(), slowDisk),
                Clock.systemDefaultZone())) {

            List<LogBuffer> buffers = new ArrayList<>();
            for (int s = 0; s < streams; s++) {
                buffers.add(logs.buffer("stream-" + s));
            }

            AtomicLong slowestAppendNanos = new AtomicLong();
            long started = System.nanoTime();
            flood(buffers, linesPerStream, slowestAppendNanos);
            long floodMillis = (System.nanoTime() - started) / 1_000_000;

            // One more line per stream so every file receives its pending drop annotation
            logs.writer().awaitIdle(config.closeTimeout());
            for (LogBuffer buffer : buffers) {
                buffer.append("done\n");
                logs.writer().awaitIdle(config.closeTimeout());
            }

            long dropped = logs.writer().droppedCount();
            long appended = (long) streams * (linesPerStream + 1);
            long onDisk = 0;
            long annotated = 0;
            for (LogBuffer buffer : buffers) {
                for (String line : Files.readAllLines(buffer.file(), StandardCharsets.UTF_8)) {
                    Matcher m = DROP_NOTICE.matcher(line);
                    if (m.matches()) {
                        annotated += Long.parseLong(m.group(1));
                    } else {
                        onDisk++;
                    }
                }
            }

            System.out.printf("flood took %d ms, slowest append %.3f ms%n", floodMillis, slowestAppendNanos.get() / 1e6);
            System.out.printf("appended=%d, onDisk=%d, dropped=%d, annotated=%d%n%n", appended, onDisk, dropped, annotated);

            passed = check("every appended line is on disk or counted as dropped", onDisk + dropped == appended)
                    & check("annotations match the drop count", annotated == dropped)
                    & check("no append blocked for 100 ms or more", slowestAppendNanos.get() < 100_000_000L);
        } finally {
            deleteRecursively(dir);
        }

        System.out.println();
        System.out.println(passed ? "RESULT: PASSED" : "RESULT: FAILED");
        System.exit(passed ? 0 : 1);
    }

    private static void flood(List<LogBuffer> buffers, int linesPerStream, AtomicLong slowest)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(buffers.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(buffers.size());
        try {
            for (LogBuffer buffer : buffers) {
                executor.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < linesPerStream; i++) {
                            long t0 = System.nanoTime();
                            buffer.append(buffer.name() + " line " + i + "\n");
                            slowest.accumulateAndGet(System.nanoTime() - t0, Math::max);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            done.await();
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    private static FileAppender slow(FileAppender delegate) {
        return (path, text) -> {
            long until = System.nanoTime() + DISK_DELAY_MICROS * 1000;
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            delegate.append(path, text);
        };
    }

    private static boolean check(String description, boolean ok) {
        System.out.println((ok ? "  [PASS] " : "  [FAIL] ") + description);
        return ok;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}

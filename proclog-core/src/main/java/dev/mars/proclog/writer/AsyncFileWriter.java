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
package dev.mars.proclog.writer;

import dev.mars.proclog.config.ProcLogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue-backed implementation of {@link LogWriter}.
 * <p>
 * Producer threads enqueue {@code (path, text)} jobs; a single daemon thread
 * named {@code log-writer} drains the queue and appends to disk through a
 * {@link FileAppender}.
 * <p>
 * <b>Backpressure:</b>
 * The queue is bounded. When it is full the job is dropped and counted against
 * its destination. The next successful write to that destination is followed by
 * an annotation line:
 * <pre>
 * [log-writer] dropped 17 chunks due to backpressure
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * {@link #write(Path, String)} may be called from any number of threads.
 * All disk I/O happens on the worker thread, so writes to a file are applied in
 * enqueue order.
 * <p>
 * <b>Failure Handling:</b>
 * A failed append is turned into a {@link WriteOutcome}, logged and skipped.
 * Nothing thrown by the appender can terminate the worker.
 */
public final class AsyncFileWriter implements LogWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncFileWriter.class);

    /** Worker thread name. */
    public static final String THREAD_NAME = "log-writer";

    private static final String DROP_NOTICE = "[log-writer] dropped %d chunks due to backpressure\n";

    private final BlockingQueue<WriteJob> queue;
    private final int capacity;
    private final FileAppender appender;
    private final long pollMillis;
    private final Duration defaultCloseTimeout;

    /** Drops not yet annotated, keyed by normalized destination. */
    private final ConcurrentMap<Path, AtomicLong> unreportedDrops = new ConcurrentHashMap<>();
    private final AtomicLong droppedTotal = new AtomicLong();

    /** Accepted jobs that are queued or being written. */
    private final AtomicInteger inFlight = new AtomicInteger();

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean stopRequested = false;

    /**
     * Guards admission against worker exit: a job is either offered before the
     * worker's final empty-queue check, or rejected after it.
     */
    private final Object exitLock = new Object();
    private boolean workerExited = false;
    private final Thread worker;

    /**
     * Creates and starts a writer using the queue and timing settings of {@code config}.
     *
     * @param config the configuration
     */
    public AsyncFileWriter(ProcLogConfig config) {
        this(config.writerQueueCapacity(), config.writerPollInterval(), config.closeTimeout(), FileAppender.nio());
    }

    /**
     * Creates and starts a writer.
     *
     * @param capacity            maximum number of queued jobs (> 0)
     * @param pollInterval        how long the worker waits for a job before re-checking for stop
     * @param defaultCloseTimeout timeout used by {@link #close()}
     * @param appender            performs the actual disk write
     */
    public AsyncFileWriter(int capacity, Duration pollInterval, Duration defaultCloseTimeout, FileAppender appender) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, was " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.pollMillis = Math.max(1L, pollInterval.toMillis());
        this.defaultCloseTimeout = Objects.requireNonNull(defaultCloseTimeout, "defaultCloseTimeout");
        this.appender = Objects.requireNonNull(appender, "appender");

        this.worker = new Thread(this::run, THREAD_NAME);
        this.worker.setDaemon(true);
        this.worker.start();

        LOG.info("AsyncFileWriter started: capacity={}, pollInterval={} ms", capacity, pollMillis);
    }

    // ========================================================================
    // Producer side
    // ========================================================================

    @Override
    public void write(Path path, String text) {
        if (path == null || text == null || text.isEmpty()) {
            return;
        }
        Path key = key(path);

        boolean accepted;
        inFlight.incrementAndGet();
        synchronized (exitLock) {
            accepted = !workerExited && queue.offer(new WriteJob(key, text));
        }
        if (!accepted) {
            inFlight.decrementAndGet();
            recordDrop(key);
            return;
        }
        LOG.trace("Queued {} chars for {}", text.length(), key);
    }

    @Override
    public int discardPending(Path path) {
        if (path == null) {
            return 0;
        }
        Path key = key(path);
        AtomicInteger removed = new AtomicInteger();
        queue.removeIf(job -> {
            if (job.path().equals(key)) {
                removed.incrementAndGet();
                return true;
            }
            return false;
        });
        int count = removed.get();
        if (count > 0) {
            inFlight.addAndGet(-count);
            LOG.debug("Discarded {} pending writes for {}", count, key);
        }
        return count;
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    @Override
    public long droppedCount() {
        return droppedTotal.get();
    }

    @Override
    public int pendingCount() {
        return inFlight.get();
    }

    /** Maximum number of queued jobs. */
    public int capacity() {
        return capacity;
    }

    /** Whether the worker thread is still running. */
    public boolean isRunning() {
        return worker.isAlive();
    }

    // ========================================================================
    // Shutdown
    // ========================================================================

    @Override
    public void close() {
        close(defaultCloseTimeout);
    }

    @Override
    public void close(Duration timeout) {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Closing AsyncFileWriter: {} pending jobs", inFlight.get());
            stopRequested = true;
        }

        long waitMillis = timeout == null ? 0L : timeout.toMillis();
        if (waitMillis > 0) {
            try {
                worker.join(waitMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (worker.isAlive()) {
            LOG.warn("AsyncFileWriter did not drain within {} ms, {} jobs still pending", waitMillis, inFlight.get());
        } else {
            LOG.info("AsyncFileWriter closed: {} chunks dropped in total", droppedTotal.get());
        }
    }

    // ========================================================================
    // Worker side
    // ========================================================================

    private void run() {
        try {
            while (!(stopRequested && exitIfDrained())) {
                WriteJob job;
                try {
                    job = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    LOG.warn("Writer thread interrupted, {} queued jobs counted as dropped", queue.size());
                    Thread.currentThread().interrupt();
                    return;
                }
                if (job == null) {
                    continue;
                }

                try {
                    WriteOutcome outcome = process(job);
                    if (!outcome.succeeded()) {
                        LOG.warn("Failed to append {} chars to {}: {}",
                                job.text().length(), outcome.path(), outcome.error().getMessage());
                    }
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        } finally {
            abandonRemaining();
        }
        LOG.debug("Writer thread exiting");
    }

    /**
     * Marks the worker as exited if nothing is queued. Once this returns true no
     * further job can be admitted.
     */
    private boolean exitIfDrained() {
        synchronized (exitLock) {
            if (queue.isEmpty()) {
                workerExited = true;
                return true;
            }
            return false;
        }
    }

    /**
     * Closes admission and counts anything still queued as dropped, so that an
     * abnormal worker exit never loses jobs silently.
     */
    private void abandonRemaining() {
        List<WriteJob> abandoned = new ArrayList<>();
        synchronized (exitLock) {
            workerExited = true;
            queue.drainTo(abandoned);
        }
        for (WriteJob job : abandoned) {
            inFlight.decrementAndGet();
            recordDrop(job.path());
        }
    }

    /**
     * Writes one job and, if it succeeded, the drop annotation owed to its file.
     * Must be called from the worker thread.
     */
    private WriteOutcome process(WriteJob job) {
        WriteOutcome outcome = append(job.path(), job.text());
        if (!outcome.succeeded()) {
            return outcome;
        }

        AtomicLong owed = unreportedDrops.get(job.path());
        long dropped = owed == null ? 0L : owed.getAndSet(0L);
        if (dropped > 0) {
            WriteOutcome notice = append(job.path(), String.format(DROP_NOTICE, dropped));
            if (notice.succeeded()) {
                LOG.info("Recorded {} dropped chunks in {}", dropped, job.path());
            } else {
                // Keep the count so the next successful write reports it
                owed.addAndGet(dropped);
            }
        }
        return outcome;
    }

    private WriteOutcome append(Path path, String text) {
        try {
            appender.append(path, text);
            LOG.trace("Appended {} chars to {}", text.length(), path);
            return WriteOutcome.success(path);
        } catch (IOException e) {
            return WriteOutcome.failure(path, e);
        } catch (RuntimeException e) {
            return WriteOutcome.failure(path, new IOException("Appender failed: " + e, e));
        }
    }

    private void recordDrop(Path key) {
        droppedTotal.incrementAndGet();
        long owed = unreportedDrops.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        if (owed == 1) {
            LOG.warn("Dropping chunks for {}: queue full ({} jobs) or writer stopped", key, capacity);
        }
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private record WriteJob(Path path, String text) {
    }
}

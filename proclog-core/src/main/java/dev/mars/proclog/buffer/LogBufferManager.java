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
import dev.mars.proclog.writer.AsyncFileWriter;
import dev.mars.proclog.writer.LogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Owns the buffers of all monitored streams and the writer they share.
 * <p>
 * The writer is started on the first write, not at construction, and stopped by
 * {@link #shutdown(Duration)} or {@link #close()}. Buffers keep a handle that
 * survives a shutdown: using the manager afterwards starts a fresh writer.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * try (LogBufferManager logs = new LogBufferManager(ProcLogConfig.load())) {
 *     LogBuffer web = logs.buffer("web");
 *     web.append(chunk);
 *     ...
 * } // drains the writer for up to closeTimeout
 * }</pre>
 */
public final class LogBufferManager implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(LogBufferManager.class);

    private final ProcLogConfig config;
    private final Function<ProcLogConfig, LogWriter> writerFactory;
    private final Clock clock;
    private final ConcurrentMap<String, LogBuffer> buffers = new ConcurrentHashMap<>();
    private final LogWriter handle = new WriterHandle();

    private volatile LogWriter current;

    public LogBufferManager(ProcLogConfig config) {
        this(config, AsyncFileWriter::new, Clock.systemDefaultZone());
    }

    /**
     * @param config        configuration shared by every buffer
     * @param writerFactory creates the writer on first use
     * @param clock         timestamp source for new buffers
     */
    public LogBufferManager(ProcLogConfig config, Function<ProcLogConfig, LogWriter> writerFactory, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.writerFactory = Objects.requireNonNull(writerFactory, "writerFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProcLogConfig config() {
        return config;
    }

    /**
     * Returns the buffer for {@code name}, creating it on first request.
     *
     * @throws IllegalArgumentException if {@code name} cannot be used as a file name
     */
    public LogBuffer buffer(String name) {
        return buffers.computeIfAbsent(name, n -> {
            LOG.info("Creating log buffer '{}' at {}", n, config.logFile(n));
            return new LogBuffer(n, config, handle, clock);
        });
    }

    public Optional<LogBuffer> find(String name) {
        return Optional.ofNullable(buffers.get(name));
    }

    /** Names of all registered buffers, sorted. */
    public Set<String> names() {
        return new TreeSet<>(buffers.keySet());
    }

    /**
     * Unregisters a buffer. Its file is left on disk.
     *
     * @return the removed buffer, if there was one
     */
    public Optional<LogBuffer> remove(String name) {
        return Optional.ofNullable(buffers.remove(name));
    }

    /**
     * The writer handle given to every buffer. Writing through it starts the
     * writer if needed; closing it shuts the current writer down.
     */
    public LogWriter writer() {
        return handle;
    }

    /** Whether a writer is currently running. */
    public boolean writerStarted() {
        return current != null;
    }

    /**
     * Stops the current writer, waiting up to {@code timeout} for it to drain.
     * Does nothing if no writer was started.
     */
    public void shutdown(Duration timeout) {
        LogWriter stopping;
        synchronized (this) {
            stopping = current;
            current = null;
        }
        if (stopping == null) {
            return;
        }
        LOG.info("Shutting down log writer for {} buffers", buffers.size());
        stopping.close(timeout);
    }

    /** Shuts down with the configured close timeout. */
    @Override
    public void close() {
        shutdown(config.closeTimeout());
    }

    private LogWriter started() {
        LogWriter w = current;
        if (w == null) {
            synchronized (this) {
                w = current;
                if (w == null) {
                    w = writerFactory.apply(config);
                    current = w;
                }
            }
        }
        return w;
    }

    /**
     * Stable writer reference for buffers; resolves the live writer per call.
     */
    private final class WriterHandle implements LogWriter {

        @Override
        public void write(Path path, String text) {
            if (text == null || text.isEmpty()) {
                return;
            }
            started().write(path, text);
        }

        @Override
        public int discardPending(Path path) {
            LogWriter w = current;
            return w == null ? 0 : w.discardPending(path);
        }

        @Override
        public boolean awaitIdle(Duration timeout) {
            LogWriter w = current;
            return w == null || w.awaitIdle(timeout);
        }

        @Override
        public long droppedCount() {
            LogWriter w = current;
            return w == null ? 0L : w.droppedCount();
        }

        @Override
        public int pendingCount() {
            LogWriter w = current;
            return w == null ? 0 : w.pendingCount();
        }

        @Override
        public void close(Duration timeout) {
            shutdown(timeout);
        }

        @Override
        public void close() {
            LogBufferManager.this.close();
        }
    }
}

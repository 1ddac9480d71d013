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
package dev.mars.proclog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for process log buffers and the background writer.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dproclog.logsDir=/path})</li>
 *   <li>Environment variables (e.g., {@code PROCLOG_LOGS_DIR})</li>
 *   <li>Properties file ({@code proclog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>logsDir</td><td>proclog.logsDir</td><td>PROCLOG_LOGS_DIR</td><td>~/.proclog/logs</td></tr>
 *   <tr><td>maxLogLines</td><td>proclog.maxLogLines</td><td>PROCLOG_MAX_LOG_LINES</td><td>5000</td></tr>
 *   <tr><td>historyChunk</td><td>proclog.historyChunk</td><td>PROCLOG_HISTORY_CHUNK</td><td>500</td></tr>
 *   <tr><td>writerQueueCapacity</td><td>proclog.writerQueueCapacity</td><td>PROCLOG_WRITER_QUEUE_CAPACITY</td><td>10000</td></tr>
 *   <tr><td>writerPollMillis</td><td>proclog.writerPollMillis</td><td>PROCLOG_WRITER_POLL_MILLIS</td><td>200</td></tr>
 *   <tr><td>closeTimeoutMillis</td><td>proclog.closeTimeoutMillis</td><td>PROCLOG_CLOSE_TIMEOUT_MILLIS</td><td>2000</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # proclog.properties
 * proclog.logsDir=/var/log/myapp/processes
 * proclog.maxLogLines=5000
 * proclog.historyChunk=500
 * proclog.writerQueueCapacity=10000
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * ProcLogConfig config = ProcLogConfig.builder()
 *     .logsDir(Path.of("/var/log/myapp"))
 *     .maxLogLines(2000)
 *     .build();
 *
 * try (LogBufferManager manager = new LogBufferManager(config)) {
 *     manager.buffer("web").append(chunk);
 * }
 * </pre>
 */
public final class ProcLogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ProcLogConfig.class);

    private static final String PROPERTIES_FILE = "proclog.properties";

    // Property keys
    private static final String PROP_LOGS_DIR = "proclog.logsDir";
    private static final String PROP_MAX_LOG_LINES = "proclog.maxLogLines";
    private static final String PROP_HISTORY_CHUNK = "proclog.historyChunk";
    private static final String PROP_WRITER_QUEUE_CAPACITY = "proclog.writerQueueCapacity";
    private static final String PROP_WRITER_POLL_MILLIS = "proclog.writerPollMillis";
    private static final String PROP_CLOSE_TIMEOUT_MILLIS = "proclog.closeTimeoutMillis";

    // Environment variable keys
    private static final String ENV_LOGS_DIR = "PROCLOG_LOGS_DIR";
    private static final String ENV_MAX_LOG_LINES = "PROCLOG_MAX_LOG_LINES";
    private static final String ENV_HISTORY_CHUNK = "PROCLOG_HISTORY_CHUNK";
    private static final String ENV_WRITER_QUEUE_CAPACITY = "PROCLOG_WRITER_QUEUE_CAPACITY";
    private static final String ENV_WRITER_POLL_MILLIS = "PROCLOG_WRITER_POLL_MILLIS";
    private static final String ENV_CLOSE_TIMEOUT_MILLIS = "PROCLOG_CLOSE_TIMEOUT_MILLIS";

    // Defaults
    private static final Path DEFAULT_LOGS_DIR = Path.of(System.getProperty("user.home"), ".proclog", "logs");
    private static final int DEFAULT_MAX_LOG_LINES = 5000;
    private static final int DEFAULT_HISTORY_CHUNK = 500;
    private static final int DEFAULT_WRITER_QUEUE_CAPACITY = 10_000;
    private static final long DEFAULT_WRITER_POLL_MILLIS = 200;
    private static final long DEFAULT_CLOSE_TIMEOUT_MILLIS = 2000;

    private final Path logsDir;
    private final int maxLogLines;
    private final int historyChunk;
    private final int writerQueueCapacity;
    private final long writerPollMillis;
    private final long closeTimeoutMillis;

    private ProcLogConfig(Builder builder) {
        this.logsDir = builder.logsDir;
        this.maxLogLines = builder.maxLogLines;
        this.historyChunk = builder.historyChunk;
        this.writerQueueCapacity = builder.writerQueueCapacity;
        this.writerPollMillis = builder.writerPollMillis;
        this.closeTimeoutMillis = builder.closeTimeoutMillis;
    }

    /** Directory holding one {@code <name>.log} file per stream. */
    public Path logsDir() {
        return logsDir;
    }

    /** Capacity of each buffer's in-memory ring. */
    public int maxLogLines() {
        return maxLogLines;
    }

    /** Default page size for history pagination. */
    public int historyChunk() {
        return historyChunk;
    }

    /** Maximum number of queued write jobs before chunks are dropped. */
    public int writerQueueCapacity() {
        return writerQueueCapacity;
    }

    /** How often the writer thread wakes up to check for a stop request. */
    public Duration writerPollInterval() {
        return Duration.ofMillis(writerPollMillis);
    }

    /** How long shutdown waits for the writer to drain. */
    public Duration closeTimeout() {
        return Duration.ofMillis(closeTimeoutMillis);
    }

    /** Resolves the backing file of a stream. */
    public Path logFile(String streamName) {
        return logsDir.resolve(streamName + ".log");
    }

    @Override
    public String toString() {
        return "ProcLogConfig{" +
                "logsDir=" + logsDir +
                ", maxLogLines=" + maxLogLines +
                ", historyChunk=" + historyChunk +
                ", writerQueueCapacity=" + writerQueueCapacity +
                ", writerPollMillis=" + writerPollMillis +
                ", closeTimeoutMillis=" + closeTimeoutMillis +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ProcLogConfig.builder().build()}.
     */
    public static ProcLogConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link ProcLogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path logsDir;
        private Integer maxLogLines;
        private Integer historyChunk;
        private Integer writerQueueCapacity;
        private Long writerPollMillis;
        private Long closeTimeoutMillis;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the log directory. */
        public Builder logsDir(Path logsDir) {
            this.logsDir = logsDir;
            return this;
        }

        /** Sets the log directory from a string path. */
        public Builder logsDir(String logsDir) {
            this.logsDir = Path.of(logsDir);
            return this;
        }

        /** Sets the in-memory line cap per buffer (default: 5000). */
        public Builder maxLogLines(int maxLogLines) {
            this.maxLogLines = maxLogLines;
            return this;
        }

        /** Sets the default history page size (default: 500). */
        public Builder historyChunk(int historyChunk) {
            this.historyChunk = historyChunk;
            return this;
        }

        /** Sets the writer queue capacity (default: 10000). */
        public Builder writerQueueCapacity(int writerQueueCapacity) {
            this.writerQueueCapacity = writerQueueCapacity;
            return this;
        }

        /** Sets the writer poll interval (default: 200 ms). */
        public Builder writerPollInterval(Duration writerPollInterval) {
            this.writerPollMillis = writerPollInterval.toMillis();
            return this;
        }

        /** Sets the shutdown drain timeout (default: 2 s). */
        public Builder closeTimeout(Duration closeTimeout) {
            this.closeTimeoutMillis = closeTimeout.toMillis();
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a size or interval is out of range
         */
        public ProcLogConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (logsDir == null) {
                logsDir = resolve(PROP_LOGS_DIR, ENV_LOGS_DIR, Path::of, DEFAULT_LOGS_DIR);
            }
            if (maxLogLines == null) {
                maxLogLines = resolve(PROP_MAX_LOG_LINES, ENV_MAX_LOG_LINES, Integer::parseInt, DEFAULT_MAX_LOG_LINES);
            }
            if (historyChunk == null) {
                historyChunk = resolve(PROP_HISTORY_CHUNK, ENV_HISTORY_CHUNK, Integer::parseInt, DEFAULT_HISTORY_CHUNK);
            }
            if (writerQueueCapacity == null) {
                writerQueueCapacity = resolve(PROP_WRITER_QUEUE_CAPACITY, ENV_WRITER_QUEUE_CAPACITY,
                        Integer::parseInt, DEFAULT_WRITER_QUEUE_CAPACITY);
            }
            if (writerPollMillis == null) {
                writerPollMillis = resolve(PROP_WRITER_POLL_MILLIS, ENV_WRITER_POLL_MILLIS,
                        Long::parseLong, DEFAULT_WRITER_POLL_MILLIS);
            }
            if (closeTimeoutMillis == null) {
                closeTimeoutMillis = resolve(PROP_CLOSE_TIMEOUT_MILLIS, ENV_CLOSE_TIMEOUT_MILLIS,
                        Long::parseLong, DEFAULT_CLOSE_TIMEOUT_MILLIS);
            }

            requirePositive("maxLogLines", maxLogLines);
            requirePositive("historyChunk", historyChunk);
            requirePositive("writerQueueCapacity", writerQueueCapacity);
            requirePositive("writerPollMillis", writerPollMillis);
            if (closeTimeoutMillis < 0) {
                throw new IllegalArgumentException("closeTimeoutMillis must be >= 0, was " + closeTimeoutMillis);
            }

            return new ProcLogConfig(this);
        }

        /**
         * Looks a value up in system properties, then the environment, then the
         * properties file. A value that does not parse is skipped.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[] candidates = {
                    System.getProperty(sysProp),
                    System.getenv(envVar),
                    fileProperties.getProperty(sysProp)
            };
            for (String value : candidates) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value.trim());
                } catch (RuntimeException e) {
                    LOG.warn("Ignoring invalid value '{}' for {}: {}", value, sysProp, e.getMessage());
                }
            }
            return defaultValue;
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, was " + value);
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = ProcLogConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}

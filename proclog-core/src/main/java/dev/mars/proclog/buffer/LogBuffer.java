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
import dev.mars.proclog.text.AnsiText;
import dev.mars.proclog.writer.LogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Output of one supervised process stream: live ring buffer plus file-backed history.
 * <p>
 * <b>Write path:</b> {@link #append(String)} accepts raw chunks of arbitrary size.
 * Incomplete lines are held until their newline arrives; every completed line is
 * timestamped, kept in a bounded ring for live display, and handed to the
 * {@link LogWriter} in plain form. Appending never waits for disk.
 * <p>
 * <b>Read path:</b> {@link #loadChunk(int, int)}, {@link #search(String)} and
 * {@link #lineCount()} read the backing file, re-parsing it only when its
 * modification time changes. Without a file they fall back to the ring.
 * <p>
 * <b>Thread Safety:</b>
 * Not thread-safe. One producer per stream; callers serialize access.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * logs/
 *  ├─ web.log      // [2026-01-31 12:00:00] GET / 200
 *  └─ worker.log
 * </pre>
 */
public final class LogBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(LogBuffer.class);

    private final String name;
    private final Path file;
    private final int maxLines;
    private final int defaultChunkSize;
    private final LogWriter writer;
    private final Clock clock;

    /** Rendered display lines, oldest first. INVARIANT: size() <= maxLines. */
    private final Deque<String> ring = new ArrayDeque<>();
    private final HistoryCache cache = new HistoryCache();

    /** Trailing fragment without newline. INVARIANT: never contains '\n'. */
    private String partial = "";

    /** Previous chunk ended in '\r'; whether it starts a "\r\n" is decided by the next chunk. */
    private boolean pendingCarriageReturn = false;

    /**
     * Creates a buffer using the system clock.
     *
     * @param name   stream name, also the file name stem
     * @param config supplies log directory, ring capacity and page size
     * @param writer shared writer that persists completed lines
     */
    public LogBuffer(String name, ProcLogConfig config, LogWriter writer) {
        this(name, config, writer, Clock.systemDefaultZone());
    }

    /**
     * Creates a buffer.
     *
     * @param name   stream name, also the file name stem
     * @param config supplies log directory, ring capacity and page size
     * @param writer shared writer that persists completed lines
     * @param clock  source of line timestamps
     * @throws IllegalArgumentException if {@code name} cannot be used as a file name
     */
    public LogBuffer(String name, ProcLogConfig config, LogWriter writer, Clock clock) {
        this.name = validateName(name);
        Objects.requireNonNull(config, "config");
        this.file = config.logFile(name);
        this.maxLines = config.maxLogLines();
        this.defaultChunkSize = config.historyChunk();
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.debug("LogBuffer created: name={}, file={}, maxLines={}", name, file, maxLines);
    }

    public String name() {
        return name;
    }

    public Path file() {
        return file;
    }

    /** Ring capacity. */
    public int capacity() {
        return maxLines;
    }

    /** Number of lines currently held in memory. */
    public int size() {
        return ring.size();
    }

    /** Length of the fragment still waiting for its newline. */
    public int partialLength() {
        return partial.length() + (pendingCarriageReturn ? 1 : 0);
    }

    // ========================================================================
    // Ingestion
    // ========================================================================

    /**
     * Ingests a chunk of process output.
     * <p>
     * The chunk may end anywhere, including inside a line, a {@code \r\n} pair or
     * an escape sequence. Only newline-terminated lines are emitted.
     *
     * @param text raw output, may be null or empty
     * @return the display and file renderings of the lines completed by this chunk
     */
    public AppendResult append(String text) {
        if (text == null || text.isEmpty()) {
            return AppendResult.EMPTY;
        }

        String chunk = pendingCarriageReturn ? "\r" + text : text;
        pendingCarriageReturn = chunk.endsWith("\r");
        if (pendingCarriageReturn) {
            chunk = chunk.substring(0, chunk.length() - 1);
        }

        String data = partial + AnsiText.normalize(chunk);
        int lastNewline = data.lastIndexOf('\n');
        if (lastNewline < 0) {
            partial = data;
            return AppendResult.EMPTY;
        }
        partial = data.substring(lastNewline + 1);

        StringBuilder display = new StringBuilder();
        StringBuilder plain = new StringBuilder();
        int start = 0;
        while (start <= lastNewline) {
            int end = data.indexOf('\n', start);
            String content = data.substring(start, end);
            String timestamp = AnsiText.formatTimestamp(LocalDateTime.now(clock));

            String displayLine = AnsiText.displayLine(timestamp, content);
            addToRing(displayLine);
            display.append(displayLine);
            plain.append(AnsiText.fileLine(timestamp, content));

            start = end + 1;
        }

        cache.invalidate();
        persist(plain.toString());

        return new AppendResult(display.toString(), plain.toString());
    }

    /**
     * Completes the held fragment as a final line, e.g. when the process exits
     * without a trailing newline.
     *
     * @return the rendered line, or {@link AppendResult#EMPTY} if nothing was held
     */
    public AppendResult flushPartial() {
        if (partial.isEmpty() && !pendingCarriageReturn) {
            return AppendResult.EMPTY;
        }
        // A held '\r' pairs with this '\n' into a single line break
        return append("\n");
    }

    private void addToRing(String line) {
        if (ring.size() >= maxLines) {
            ring.pollFirst();
        }
        ring.addLast(line);
    }

    private void persist(String text) {
        try {
            writer.write(file, text);
        } catch (RuntimeException e) {
            LOG.warn("Could not hand output of '{}' to the log writer: {}", name, e.toString());
        }
    }

    // ========================================================================
    // Live view
    // ========================================================================

    /**
     * Returns every line held in memory, oldest first, as rendered for display.
     */
    public String getRecent() {
        return String.join("", ring);
    }

    // ========================================================================
    // History
    // ========================================================================

    /**
     * Number of lines in the history: the file if it exists, otherwise the ring.
     */
    public int lineCount() {
        return history().size();
    }

    /**
     * Loads a page of history using the configured default page size.
     *
     * @see #loadChunk(int, int)
     */
    public ChunkResult loadChunk(int end) {
        return loadChunk(end, defaultChunkSize);
    }

    /**
     * Returns up to {@code size} history lines ending before index {@code end}.
     * <p>
     * Paging backwards: start with {@code end = lineCount()}, then pass each
     * result's {@link ChunkResult#start()} as the next {@code end} until it is 0.
     * The window is always {@code [end - size, end)}; only the part of it that
     * lies inside the history is returned.
     *
     * @param end  exclusive end index
     * @param size maximum number of lines
     * @return recolored lines and the index of the first one
     */
    public ChunkResult loadChunk(int end, int size) {
        if (end <= 0 || size <= 0) {
            return ChunkResult.EMPTY;
        }
        List<String> lines = history();
        if (lines.isEmpty()) {
            return ChunkResult.EMPTY;
        }

        int start = Math.max(0, end - size);
        if (start >= lines.size()) {
            return ChunkResult.EMPTY;
        }
        int stop = Math.min(end, lines.size());
        return new ChunkResult(render(lines.subList(start, stop)), start);
    }

    /**
     * Case-insensitive substring search over the whole history.
     * An empty pattern matches every line.
     *
     * @param pattern text to look for, may be null
     * @return recolored matching lines and their count
     */
    public SearchResult search(String pattern) {
        String needle = pattern == null ? "" : pattern.toLowerCase(Locale.ROOT);
        List<String> matches = history().stream()
                .filter(line -> line.toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            return SearchResult.EMPTY;
        }
        return new SearchResult(render(matches), matches.size());
    }

    private static String render(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(AnsiText.colorizeTimestamp(line)).append('\n');
        }
        return sb.toString();
    }

    /**
     * The plain history lines, from the cache when the file is unchanged.
     */
    private List<String> history() {
        if (!Files.exists(file)) {
            return ringAsHistory();
        }
        try {
            FileTime modifiedAt = Files.getLastModifiedTime(file);
            List<String> cached = cache.lookup(modifiedAt);
            if (cached != null) {
                return cached;
            }

            // new String(byte[], UTF_8) replaces malformed input
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            List<String> lines = AnsiText.normalize(content).lines().collect(Collectors.toList());
            cache.store(modifiedAt, lines);
            LOG.debug("History of '{}' reloaded: {} lines, mtime={}", name, lines.size(), modifiedAt);
            return lines;
        } catch (IOException e) {
            LOG.debug("Cannot read history of '{}' from {}, using in-memory lines: {}", name, file, e.getMessage());
            return ringAsHistory();
        }
    }

    private List<String> ringAsHistory() {
        return ring.stream()
                .map(line -> line.endsWith("\n") ? line.substring(0, line.length() - 1) : line)
                .map(AnsiText::uncolorizeTimestamp)
                .collect(Collectors.toList());
    }

    // ========================================================================
    // Maintenance
    // ========================================================================

    /**
     * Empties the live view and truncates the backing file.
     * <p>
     * Chunks of this stream still queued in the writer are discarded. A failure
     * to truncate is logged; the in-memory state is cleared regardless.
     */
    public void clear() {
        ring.clear();
        partial = "";
        pendingCarriageReturn = false;
        cache.invalidate();

        try {
            writer.discardPending(file);
        } catch (RuntimeException e) {
            LOG.warn("Could not discard pending writes of '{}': {}", name, e.toString());
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, new byte[0]);
            LOG.info("Cleared log '{}'", name);
        } catch (IOException e) {
            LOG.warn("Could not truncate {}: {}", file, e.getMessage());
        }
    }

    boolean historyCached() {
        return cache.isPopulated();
    }

    private static String validateName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank() || name.equals(".") || name.equals("..")
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Invalid log stream name: '" + name + "'");
        }
        return name;
    }

    @Override
    public String toString() {
        return "LogBuffer{name=" + name + ", lines=" + ring.size() + ", file=" + file + '}';
    }
}

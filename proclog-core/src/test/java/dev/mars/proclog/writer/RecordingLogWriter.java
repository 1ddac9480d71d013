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

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link LogWriter} that records every call instead of touching disk.
 */
public final class RecordingLogWriter implements LogWriter {

    public record Write(Path path, String text) {
    }

    private final List<Write> writes = new CopyOnWriteArrayList<>();
    private final List<Path> discards = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;
    private volatile boolean closed;

    /** Makes every subsequent call to write/discard throw {@code e}. */
    public void failWith(RuntimeException e) {
        this.failure = e;
    }

    public List<Write> writes() {
        return writes;
    }

    public List<Path> discards() {
        return discards;
    }

    /** Everything written to {@code path}, concatenated in order. */
    public String textFor(Path path) {
        return writes.stream()
                .filter(w -> w.path().equals(path))
                .map(Write::text)
                .collect(Collectors.joining());
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void write(Path path, String text) {
        if (failure != null) {
            throw failure;
        }
        if (text == null || text.isEmpty()) {
            return;
        }
        writes.add(new Write(path, text));
    }

    @Override
    public int discardPending(Path path) {
        if (failure != null) {
            throw failure;
        }
        discards.add(path);
        return 0;
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        return true;
    }

    @Override
    public long droppedCount() {
        return 0;
    }

    @Override
    public int pendingCount() {
        return 0;
    }

    @Override
    public void close(Duration timeout) {
        closed = true;
    }

    @Override
    public void close() {
        closed = true;
    }
}

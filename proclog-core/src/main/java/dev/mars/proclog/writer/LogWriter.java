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

import java.io.Closeable;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Non-blocking log file persistence.
 * <p>
 * Producers hand over text to be appended to a file; the writer performs the
 * disk I/O elsewhere. A {@code LogBuffer} depends solely on this interface.
 * <p>
 * <b>Critical Contract:</b> {@link #write(Path, String)} must return immediately
 * regardless of disk speed or queue state. Work that cannot be accepted is
 * dropped and counted, never blocked on and never thrown.
 *
 * @see AsyncFileWriter
 */
public interface LogWriter extends Closeable {

    /**
     * Schedules {@code text} to be appended to {@code path}.
     * <p>
     * Never blocks and never throws because of queue state. Writes to the same
     * path are applied in submission order.
     *
     * @param path destination file
     * @param text text to append; null or empty is ignored
     */
    void write(Path path, String text);

    /**
     * Removes jobs for {@code path} that have not been picked up yet.
     *
     * @param path destination file
     * @return the number of discarded jobs
     */
    int discardPending(Path path);

    /**
     * Waits until every accepted job has been processed.
     *
     * @param timeout maximum time to wait
     * @return true if the writer became idle within the timeout
     */
    boolean awaitIdle(Duration timeout);

    /** Total number of jobs dropped since the writer was created. */
    long droppedCount();

    /** Number of accepted jobs not yet processed. */
    int pendingCount();

    /**
     * Requests stop and waits up to {@code timeout} for queued work to drain.
     * <p>
     * Best-effort: returns when the worker exits or the timeout elapses,
     * whichever comes first. Idempotent.
     *
     * @param timeout maximum time to wait for the worker
     */
    void close(Duration timeout);

    /**
     * Closes with the implementation's default timeout.
     */
    @Override
    void close();
}

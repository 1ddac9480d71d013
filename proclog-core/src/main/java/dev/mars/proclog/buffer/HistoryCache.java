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

import java.nio.file.attribute.FileTime;
import java.util.List;

/**
 * Memoized line list of a log file, valid for one modification time.
 * <p>
 * The cache is only as precise as the filesystem's timestamp granularity:
 * a write landing in the same tick as the read that filled the cache is not
 * seen until the cache is invalidated explicitly.
 * <p>
 * Not thread-safe; owned by a single {@link LogBuffer}.
 */
final class HistoryCache {

    private List<String> lines;
    private FileTime modifiedAt;

    /**
     * Returns the cached lines if they were read at {@code currentModifiedAt}.
     *
     * @param currentModifiedAt the file's last-modified time as observed now
     * @return the cached lines, or null on a miss
     */
    List<String> lookup(FileTime currentModifiedAt) {
        if (lines != null && modifiedAt != null && modifiedAt.equals(currentModifiedAt)) {
            return lines;
        }
        return null;
    }

    void store(FileTime modifiedAt, List<String> lines) {
        this.modifiedAt = modifiedAt;
        this.lines = List.copyOf(lines);
    }

    void invalidate() {
        lines = null;
        modifiedAt = null;
    }

    boolean isPopulated() {
        return lines != null;
    }
}

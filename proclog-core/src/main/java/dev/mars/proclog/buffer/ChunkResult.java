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

/**
 * A page of history returned by {@link LogBuffer#loadChunk(int, int)}.
 *
 * @param text  recolored lines, each newline-terminated
 * @param start index of the first returned line; pass it as the next {@code end}
 *              to page further back
 */
public record ChunkResult(String text, int start) {

    public static final ChunkResult EMPTY = new ChunkResult("", 0);

    public boolean isEmpty() {
        return text.isEmpty();
    }
}

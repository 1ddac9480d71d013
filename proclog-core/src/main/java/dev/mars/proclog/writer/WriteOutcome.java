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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Result of one attempt to append to a log file.
 *
 * @param path  the destination
 * @param error the failure, or null when the write succeeded
 */
public record WriteOutcome(Path path, IOException error) {

    public static WriteOutcome success(Path path) {
        return new WriteOutcome(path, null);
    }

    public static WriteOutcome failure(Path path, IOException error) {
        return new WriteOutcome(path, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}

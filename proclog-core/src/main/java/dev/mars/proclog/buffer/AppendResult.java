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
 * The two renderings produced by one {@link LogBuffer#append(String)} call.
 *
 * @param displayText colored lines appended to the ring, one per completed line
 * @param fileText    plain lines handed to the writer
 */
public record AppendResult(String displayText, String fileText) {

    public static final AppendResult EMPTY = new AppendResult("", "");

    /** Whether the call completed no line. */
    public boolean isEmpty() {
        return displayText.isEmpty();
    }
}

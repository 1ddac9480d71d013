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
/**
 * Per-stream log buffers.
 * <p>
 * This package provides the live and historical views of process output:
 * <ul>
 *   <li>{@link dev.mars.proclog.buffer.LogBuffer} - Ring buffer, partial-line reassembly, paged history</li>
 *   <li>{@link dev.mars.proclog.buffer.LogBufferManager} - Buffer registry and writer lifecycle</li>
 * </ul>
 * <p>
 * <b>Persisted Format:</b>
 * <pre>
 * [2026-01-31 12:00:00] Listening on :8080
 * [2026-01-31 12:00:01] GET / 200
 * [log-writer] dropped 3 chunks due to backpressure
 * </pre>
 *
 * @see dev.mars.proclog.writer.LogWriter
 */
package dev.mars.proclog.buffer;

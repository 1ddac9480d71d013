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
 * Non-blocking log file persistence.
 * <ul>
 *   <li>{@link dev.mars.proclog.writer.LogWriter} - The writer interface</li>
 *   <li>{@link dev.mars.proclog.writer.AsyncFileWriter} - Bounded queue drained by one background thread</li>
 *   <li>{@link dev.mars.proclog.writer.FileAppender} - The disk write itself</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Producers never wait:</b> a full queue drops the chunk and counts it</li>
 *   <li><b>Drops are visible:</b> counted drops are annotated into the affected file</li>
 *   <li><b>The worker never dies:</b> I/O failures are logged and skipped</li>
 * </ul>
 */
package dev.mars.proclog.writer;

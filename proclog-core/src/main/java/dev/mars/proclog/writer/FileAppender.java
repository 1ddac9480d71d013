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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends text to a file. The disk side of {@link AsyncFileWriter}.
 * <p>
 * Implementations are only ever called from the writer's worker thread.
 */
@FunctionalInterface
public interface FileAppender {

    /**
     * Appends {@code text} to {@code path}, creating the file if needed.
     *
     * @param path destination file
     * @param text text to append, UTF-8 encoded on disk
     * @throws IOException if the write fails
     */
    void append(Path path, String text) throws IOException;

    /**
     * NIO appender: creates missing parent directories, then writes through a
     * {@link FileChannel} opened in append mode.
     */
    static FileAppender nio() {
        return (path, text) -> {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
            }
            ByteBuffer buf = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
            try (FileChannel ch = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
            }
        };
    }
}

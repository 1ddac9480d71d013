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
package dev.mars.proclog.text;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Line-ending normalization and ANSI escape handling for process output.
 * <p>
 * All methods are pure and never throw on malformed input: an escape sequence
 * that is truncated or not recognised is passed through unchanged.
 * <p>
 * <b>Renderings:</b>
 * <pre>
 * display:  [ESC[94m2026-01-31 12:00:00ESC[0m] content with colors
 * file:     [2026-01-31 12:00:00] content without colors
 * </pre>
 */
public final class AnsiText {

    /** Escape character that starts every ANSI sequence. */
    public static final char ESC = '\u001B';

    /** Bright blue, used for the timestamp prefix of display lines. */
    public static final String TIMESTAMP_COLOR = ESC + "[94m";

    /** Resets all SGR attributes. */
    public static final String RESET = ESC + "[0m";

    /** Seconds resolution, local time. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * CSI ({@code ESC [ params intermediates final}), OSC terminated by BEL or ST,
     * and two-character {@code ESC Fe} escapes. {@code [} and {@code ]} are left
     * out of the Fe class so that a truncated CSI or OSC is not half-removed.
     */
    private static final Pattern ANSI_PATTERN = Pattern.compile(
            "\u001B\\[[0-?]*[ -/]*[@-~]"
                    + "|\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)"
                    + "|\u001B[@-Z\\\\^_]");

    private AnsiText() {
    }

    /**
     * Converts {@code \r\n} and bare {@code \r} to {@code \n}.
     *
     * @param text raw text, may be null
     * @return normalized text, never null
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (text.indexOf('\r') < 0) {
            return text;
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Removes ANSI escape sequences, leaving the visible text.
     *
     * @param text text possibly containing escape sequences, may be null
     * @return plain text, never null
     */
    public static String stripAnsi(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (text.indexOf(ESC) < 0) {
            return text;
        }
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    /**
     * Recolors the bracketed prefix of a plain history line.
     * <p>
     * Only the first {@code [...]} is touched, and only when the line starts with it.
     * Content after the closing bracket is returned as-is.
     *
     * @param line a line without trailing newline
     * @return the line with its prefix wrapped in {@link #TIMESTAMP_COLOR}
     */
    public static String colorizeTimestamp(String line) {
        if (line == null || !line.startsWith("[")) {
            return line;
        }
        int close = line.indexOf(']');
        if (close <= 0) {
            return line;
        }
        return "[" + TIMESTAMP_COLOR + line.substring(1, close) + RESET + "]" + line.substring(close + 1);
    }

    /**
     * Reverses {@link #displayLine}'s prefix coloring, leaving colors in the
     * content untouched. Lines without a colored prefix are returned as-is.
     *
     * @param line a display line without trailing newline
     * @return the line with a plain {@code [timestamp]} prefix
     */
    public static String uncolorizeTimestamp(String line) {
        String open = "[" + TIMESTAMP_COLOR;
        if (line == null || !line.startsWith(open)) {
            return line;
        }
        int close = line.indexOf(RESET + "]", open.length());
        if (close < 0) {
            return line;
        }
        return "[" + line.substring(open.length(), close) + line.substring(close + RESET.length());
    }

    /** Formats a timestamp for either rendering. */
    public static String formatTimestamp(LocalDateTime time) {
        return TIMESTAMP_FORMAT.format(time);
    }

    /**
     * Builds the display rendering of one complete line.
     *
     * @param timestamp formatted timestamp
     * @param content   line content without newline, colors retained
     * @return {@code [<colored timestamp>] content\n}
     */
    public static String displayLine(String timestamp, String content) {
        return "[" + TIMESTAMP_COLOR + timestamp + RESET + "] " + content + "\n";
    }

    /**
     * Builds the persisted rendering of one complete line.
     *
     * @param timestamp formatted timestamp
     * @param content   line content without newline
     * @return {@code [timestamp] plain-content\n}
     */
    public static String fileLine(String timestamp, String content) {
        return "[" + timestamp + "] " + stripAnsi(content) + "\n";
    }
}

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
package dev.mars.proclog.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProcLogConfig resolution and validation.
 */
class ProcLogConfigTest {

    private static final String[] PROPERTIES = {
            "proclog.logsDir",
            "proclog.maxLogLines",
            "proclog.historyChunk",
            "proclog.writerQueueCapacity",
            "proclog.writerPollMillis",
            "proclog.closeTimeoutMillis"
    };

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        for (String property : PROPERTIES) {
            System.clearProperty(property);
        }
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Nested
    @DisplayName("Default Values")
    class DefaultTests {

        @Test
        @DisplayName("Unset values use the documented defaults")
        void testDefaults() {
            ProcLogConfig config = ProcLogConfig.builder().build();

            assertEquals(5000, config.maxLogLines());
            assertEquals(500, config.historyChunk());
            assertEquals(10_000, config.writerQueueCapacity());
            assertEquals(Duration.ofMillis(200), config.writerPollInterval());
            assertEquals(Duration.ofSeconds(2), config.closeTimeout());
            assertEquals(Path.of(System.getProperty("user.home"), ".proclog", "logs"), config.logsDir());
        }

        @Test
        @DisplayName("load() is equivalent to builder().build()")
        void testLoad() {
            System.setProperty("proclog.maxLogLines", "42");

            assertEquals(42, ProcLogConfig.load().maxLogLines());
        }
    }

    // ========================================================================
    // System Property Resolution
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property logsDir is respected")
        void testLogsDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-logs");
            System.setProperty("proclog.logsDir", customDir.toString());

            assertEquals(customDir, ProcLogConfig.builder().build().logsDir());
        }

        @Test
        @DisplayName("Numeric system properties are respected")
        void testNumericSystemProperties() {
            System.setProperty("proclog.maxLogLines", "100");
            System.setProperty("proclog.historyChunk", "25");
            System.setProperty("proclog.writerQueueCapacity", "64");
            System.setProperty("proclog.writerPollMillis", "50");
            System.setProperty("proclog.closeTimeoutMillis", "0");

            ProcLogConfig config = ProcLogConfig.builder().build();
            assertEquals(100, config.maxLogLines());
            assertEquals(25, config.historyChunk());
            assertEquals(64, config.writerQueueCapacity());
            assertEquals(Duration.ofMillis(50), config.writerPollInterval());
            assertEquals(Duration.ZERO, config.closeTimeout());
        }

        @Test
        @DisplayName("Surrounding whitespace is ignored")
        void testWhitespaceTrimmed() {
            System.setProperty("proclog.historyChunk", "  30 ");

            assertEquals(30, ProcLogConfig.builder().build().historyChunk());
        }

        @ParameterizedTest
        @ValueSource(strings = {"not-a-number", "12.5", ""})
        @DisplayName("Unparseable system property falls back to default")
        void testInvalidSystemProperty(String value) {
            System.setProperty("proclog.maxLogLines", value);

            assertEquals(5000, ProcLogConfig.builder().build().maxLogLines());
        }
    }

    // ========================================================================
    // Programmatic Configuration
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Configuration")
    class ProgrammaticTests {

        @Test
        @DisplayName("Builder values take precedence over system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("proclog.maxLogLines", "100");
            System.setProperty("proclog.logsDir", tempDir.resolve("from-property").toString());

            ProcLogConfig config = ProcLogConfig.builder()
                    .maxLogLines(7)
                    .logsDir(tempDir.resolve("from-builder"))
                    .build();

            assertEquals(7, config.maxLogLines());
            assertEquals(tempDir.resolve("from-builder"), config.logsDir());
        }

        @Test
        @DisplayName("String and Duration setters are applied")
        void testConvenienceSetters() {
            ProcLogConfig config = ProcLogConfig.builder()
                    .logsDir(tempDir.toString())
                    .writerPollInterval(Duration.ofMillis(15))
                    .closeTimeout(Duration.ofMillis(750))
                    .build();

            assertEquals(tempDir, config.logsDir());
            assertEquals(Duration.ofMillis(15), config.writerPollInterval());
            assertEquals(Duration.ofMillis(750), config.closeTimeout());
        }

        @Test
        @DisplayName("logFile() resolves <name>.log inside logsDir")
        void testLogFile() {
            ProcLogConfig config = ProcLogConfig.builder().logsDir(tempDir).build();

            assertEquals(tempDir.resolve("web.log"), config.logFile("web"));
        }

        @Test
        @DisplayName("toString() lists the resolved values")
        void testToString() {
            String text = ProcLogConfig.builder().logsDir(tempDir).maxLogLines(9).build().toString();

            assertTrue(text.contains("maxLogLines=9"));
            assertTrue(text.contains(tempDir.toString()));
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @ParameterizedTest
        @ValueSource(ints = {0, -1})
        @DisplayName("Non-positive sizes are rejected")
        void testNonPositiveSizes(int value) {
            assertThrows(IllegalArgumentException.class,
                    () -> ProcLogConfig.builder().maxLogLines(value).build());
            assertThrows(IllegalArgumentException.class,
                    () -> ProcLogConfig.builder().historyChunk(value).build());
            assertThrows(IllegalArgumentException.class,
                    () -> ProcLogConfig.builder().writerQueueCapacity(value).build());
        }

        @Test
        @DisplayName("Zero poll interval is rejected")
        void testZeroPollInterval() {
            assertThrows(IllegalArgumentException.class,
                    () -> ProcLogConfig.builder().writerPollInterval(Duration.ZERO).build());
        }

        @Test
        @DisplayName("Negative close timeout is rejected, zero is allowed")
        void testCloseTimeout() {
            assertThrows(IllegalArgumentException.class,
                    () -> ProcLogConfig.builder().closeTimeout(Duration.ofMillis(-1)).build());
            assertEquals(Duration.ZERO, ProcLogConfig.builder().closeTimeout(Duration.ZERO).build().closeTimeout());
        }

        @Test
        @DisplayName("Out-of-range system property is rejected, not defaulted")
        void testOutOfRangeSystemProperty() {
            System.setProperty("proclog.historyChunk", "0");

            assertThrows(IllegalArgumentException.class, () -> ProcLogConfig.builder().build());
        }
    }
}

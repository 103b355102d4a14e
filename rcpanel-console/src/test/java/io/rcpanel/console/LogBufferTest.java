/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.rcpanel.console;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.message.SimpleMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LogBuffer")
class LogBufferTest {

    private LogBuffer appender;

    @BeforeEach
    void setUp() {
        LogBuffer.clearBuffered();
        LogBuffer.setDisplayLevel(Level.INFO);
        appender = LogBuffer.createAppender("test");
    }

    @AfterEach
    void tearDown() {
        appender.stop();
        LogBuffer.clearBuffered();
        LogBuffer.setDisplayLevel(Level.INFO);
    }

    private static LogEvent event(Level level, String message) {
        return Log4jLogEvent.newBuilder()
            .setLoggerName("io.rcpanel.supervisor.ProcessSupervisor")
            .setLevel(level)
            .setMessage(new SimpleMessage(message))
            .build();
    }

    @Test
    @DisplayName("should format with the simple logger name and level")
    void shouldFormat() {
        String formatted = LogBuffer.format(event(Level.WARN, "Cannot find rclone"));

        assertThat(formatted).matches("\\[\\+\\d{2}:\\d{2}\\.\\d{3}] \\[WARN ] ProcessSupervisor - Cannot find rclone");
    }

    @Test
    @DisplayName("should buffer messages while no panel is active")
    void shouldBuffer() {
        appender.append(event(Level.INFO, "early"));
        appender.append(event(Level.ERROR, "early failure"));

        assertThat(LogBuffer.bufferedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should drop events below the display level")
    void shouldFilterByLevel() {
        appender.append(event(Level.DEBUG, "noise"));
        LogBuffer.setDisplayLevel(Level.DEBUG);
        appender.append(event(Level.DEBUG, "detail"));

        assertThat(LogBuffer.bufferedCount()).isEqualTo(1);
    }
}

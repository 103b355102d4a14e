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
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginElement;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.core.layout.PatternLayout;

import java.io.Serializable;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Log4j 2 appender that forwards log events to the active {@link ConsolePanel}, where they
 * appear in the log section below the trees.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #setActivePanel(ConsolePanel)} is called by the panel once its terminal is
 *       ready; messages logged before that are buffered and flushed to it.</li>
 *   <li>{@link #clearActivePanel(ConsolePanel)} is called when the panel closes; later messages are
 *       buffered again.</li>
 * </ul>
 *
 * <h2>Message Format</h2>
 * <pre>[+mm:ss.SSS] [LEVEL] LoggerName - Message</pre>
 *
 * <p>Events below the {@linkplain #setDisplayLevel(Level) display level} are dropped.</p>
 *
 * @see ConsolePanelLogIntercept
 */
@Plugin(name = "LogBuffer", category = "Core", elementType = "appender", printObject = true)
public class LogBuffer extends AbstractAppender {

    static final int MAX_BUFFERED = 10000;
    private static final long START_TIME = System.currentTimeMillis();

    private static volatile ConsolePanel activePanel;
    private static final Queue<String> bufferedMessages = new ConcurrentLinkedQueue<>();
    private static volatile Level displayLevel = Level.INFO;

    protected LogBuffer(String name, Layout<? extends Serializable> layout) {
        super(name,
                null,
                Objects.requireNonNullElse(layout, PatternLayout.newBuilder().withPattern("%msg").build()),
                false,
                null);
    }

    /**
     * Log4j 2 plugin factory, used when the appender is named in {@code log4j2.xml}.
     *
     * @param name   the appender name
     * @param layout the layout, optional
     * @return a started appender
     */
    @PluginFactory
    public static LogBuffer createAppender(@PluginAttribute("name") String name,
                                           @PluginElement("Layout") Layout<? extends Serializable> layout) {
        LogBuffer appender = new LogBuffer(Objects.requireNonNullElse(name, "LogBuffer"), layout);
        appender.start();
        return appender;
    }

    public static LogBuffer createAppender(String name) {
        return createAppender(name, null);
    }

    /**
     * Makes {@code panel} the receiver of log messages and flushes anything buffered so far.
     *
     * @param panel the panel, or null to resume buffering
     */
    public static void setActivePanel(ConsolePanel panel) {
        activePanel = panel;
        if (panel != null) {
            String msg;
            while ((msg = bufferedMessages.poll()) != null) {
                panel.addLogMessage(msg);
            }
        }
    }

    /**
     * Resumes buffering. Only clears the receiver if it is still {@code panel}.
     */
    public static void clearActivePanel(ConsolePanel panel) {
        if (activePanel == panel) {
            activePanel = null;
        }
    }

    public static void setDisplayLevel(Level level) {
        displayLevel = Objects.requireNonNull(level, "level");
    }

    public static Level getDisplayLevel() {
        return displayLevel;
    }

    /**
     * @return the number of messages waiting for a panel
     */
    static int bufferedCount() {
        return bufferedMessages.size();
    }

    static void clearBuffered() {
        bufferedMessages.clear();
    }

    @Override
    public void append(LogEvent event) {
        Level eventLevel = event.getLevel();
        // lower intLevel is more severe
        if (eventLevel.intLevel() > displayLevel.intLevel()) {
            return;
        }
        String formattedMessage = format(event);
        ConsolePanel panel = activePanel;
        if (panel != null) {
            panel.addLogMessage(formattedMessage);
        } else if (bufferedMessages.size() < MAX_BUFFERED) {
            bufferedMessages.offer(formattedMessage);
        }
    }

    static String format(LogEvent event) {
        StringBuilder line = new StringBuilder(elapsed(event.getTimeMillis()))
                .append(' ')
                .append(String.format("[%-5s]", event.getLevel()))
                .append(' ')
                .append(simpleName(event.getLoggerName()))
                .append(" - ")
                .append(event.getMessage().getFormattedMessage());
        Throwable thrown = event.getThrown();
        if (thrown != null) {
            line.append('\n').append(thrown);
        }
        return line.toString();
    }

    private static String elapsed(long timeMillis) {
        long elapsed = Math.max(0, timeMillis - START_TIME);
        return String.format("[+%02d:%02d.%03d]", elapsed / 60_000, (elapsed / 1000) % 60, elapsed % 1000);
    }

    private static String simpleName(String loggerName) {
        if (loggerName == null || loggerName.isEmpty()) {
            return "root";
        }
        String simple = loggerName.substring(loggerName.lastIndexOf('.') + 1);
        return simple.isEmpty() ? loggerName : simple;
    }
}

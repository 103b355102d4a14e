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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.slf4j.bridge.SLF4JBridgeHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes all logging into the {@link ConsolePanel} log section while the panel owns the
 * terminal. Installing it:
 * <ul>
 *   <li>removes the existing root appenders, so nothing writes over the panel,</li>
 *   <li>installs a {@link LogBuffer} appender receiving every event,</li>
 *   <li>bridges {@code java.util.logging} through SLF4J into Log4j 2.</li>
 * </ul>
 *
 * <p>Call once, before the panel is built:</p>
 * <pre>{@code
 * ConsolePanelLogIntercept.install();
 * try (ConsolePanel panel = ConsolePanel.builder().withController(controller).build()) {
 *     panel.run();
 * }
 * }</pre>
 */
public final class ConsolePanelLogIntercept {

    private static final Logger logger = LogManager.getLogger(ConsolePanelLogIntercept.class);

    private static final AtomicBoolean CONFIGURING = new AtomicBoolean(false);
    static final String APPENDER_NAME = "ConsolePanelLogBuffer";

    private ConsolePanelLogIntercept() {
    }

    /**
     * Installs the panel appender. Repeated calls reuse the installed appender.
     */
    public static void install() {
        if (!CONFIGURING.compareAndSet(false, true)) {
            return;
        }

        try {
            LoggerContext context = (LoggerContext) LogManager.getContext(false);
            Configuration configuration = context.getConfiguration();
            LoggerConfig rootConfig = configuration.getRootLogger();
            if (rootConfig.getAppenders().containsKey(APPENDER_NAME)) {
                return;
            }

            PatternLayout layout = PatternLayout.newBuilder()
                    .withPattern("%msg")
                    .withConfiguration(configuration)
                    .build();

            LogBuffer appender = LogBuffer.createAppender(APPENDER_NAME, layout);
            configuration.addAppender(appender);

            for (String appenderName : new ArrayList<>(rootConfig.getAppenders().keySet())) {
                rootConfig.removeAppender(appenderName);
            }

            // LogBuffer applies the display level itself
            rootConfig.addAppender(appender, Level.ALL, null);
            rootConfig.setLevel(Level.ALL);

            for (LoggerConfig loggerConfig : configuration.getLoggers().values()) {
                if (loggerConfig != rootConfig) {
                    List<String> appenders = new ArrayList<>(loggerConfig.getAppenders().keySet());
                    for (String appenderName : appenders) {
                        loggerConfig.removeAppender(appenderName);
                    }
                    loggerConfig.setLevel(null);
                    loggerConfig.setAdditive(true);
                }
            }

            context.updateLoggers();

            installJulBridge();
        } finally {
            CONFIGURING.set(false);
        }
    }

    private static void installJulBridge() {
        try {
            java.util.logging.LogManager.getLogManager().reset();
            SLF4JBridgeHandler.removeHandlersForRootLogger();
            SLF4JBridgeHandler.install();
        } catch (RuntimeException e) {
            logger.debug("java.util.logging bridge not installed: {}", e.getMessage());
        }
    }
}

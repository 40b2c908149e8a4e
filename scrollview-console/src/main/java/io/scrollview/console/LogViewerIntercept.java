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

package io.scrollview.console;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes Log4j 2 output into a log viewer panel. For {@link OutputMode#INTERACTIVE} the
 * existing root appenders are replaced by a {@link LogItemAppender}, so log lines do not
 * scribble over the full-screen panel; every other mode leaves the configuration alone.
 *
 * <pre>{@code
 * LogViewerIntercept.configure(OutputMode.detect());
 * try (ConsoleListPanel panel = ConsoleListPanel.builder().withLogCapture(true).build()) {
 *     panel.start();
 *     LogManager.getLogger(Main.class).info("shown in the panel");
 * }
 * }</pre>
 */
public final class LogViewerIntercept {

    static final String APPENDER_NAME = "ScrollViewLogItems";

    private static final AtomicBoolean CONFIGURING = new AtomicBoolean(false);

    private LogViewerIntercept() {
    }

    /**
     * Installs the viewer appender when {@code outputMode} is interactive. Safe to call more
     * than once.
     *
     * @param outputMode the mode the program runs in
     * @return true if the appender is installed on the root logger afterwards
     */
    public static boolean configure(OutputMode outputMode) {
        OutputMode resolved = outputMode == OutputMode.AUTO ? OutputMode.detect() : outputMode;
        if (resolved != OutputMode.INTERACTIVE) {
            return false;
        }
        if (!CONFIGURING.compareAndSet(false, true)) {
            return isInstalled();
        }
        try {
            install();
            return true;
        } finally {
            CONFIGURING.set(false);
        }
    }

    /**
     * True if the viewer appender is attached to the root logger of the current context.
     */
    public static boolean isInstalled() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        return context.getConfiguration().getRootLogger().getAppenders().containsKey(APPENDER_NAME);
    }

    private static void install() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration configuration = context.getConfiguration();
        LoggerConfig rootConfig = configuration.getRootLogger();

        if (rootConfig.getAppenders().containsKey(APPENDER_NAME)) {
            return;
        }

        LogItemAppender appender = LogItemAppender.createAppender(APPENDER_NAME);
        configuration.addAppender(appender);

        List<String> existing = new ArrayList<>(rootConfig.getAppenders().keySet());
        for (String name : existing) {
            rootConfig.removeAppender(name);
        }

        // the appender filters by its own display level
        rootConfig.addAppender(appender, Level.ALL, null);
        rootConfig.setLevel(Level.ALL);

        for (LoggerConfig loggerConfig : configuration.getLoggers().values()) {
            if (loggerConfig != rootConfig) {
                for (String name : new ArrayList<>(loggerConfig.getAppenders().keySet())) {
                    loggerConfig.removeAppender(name);
                }
                loggerConfig.setLevel(null);
                loggerConfig.setAdditive(true);
            }
        }

        context.updateLoggers();
    }
}

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

import io.scrollview.core.stream.ProducerSink;
import io.scrollview.core.stream.StreamEvent;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log4j 2 appender that turns log events into {@link StreamEvent.LogRecord}s for a log viewer
 * panel. Each event becomes one {@code LogItem} in the panel's list.
 *
 * <p>The appender is installed by {@link LogViewerIntercept}. A {@link ConsoleListPanel} built
 * with log capture registers its producer sink through {@link #setActiveSink(ProducerSink)}.
 * While no sink is registered, up to {@value #MAX_BUFFER_SIZE} records are held back and
 * flushed into the next sink, so startup logging is not lost.</p>
 *
 * <h2>Record Format</h2>
 * <pre>[+mm:ss.SSS] [LEVEL] LoggerName - Message</pre>
 * <p>The time is relative to class initialisation and the logger name is reduced to its simple
 * name, for example {@code [+00:02.345] [INFO ] Loader - Starting}.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Events arrive on arbitrary threads. The buffer is a lock-free queue and the active sink a
 * volatile reference; the sink itself is thread-safe.</p>
 */
@Plugin(name = "LogItemAppender", category = Core.CATEGORY_NAME, elementType = Appender.ELEMENT_TYPE, printObject = true)
public class LogItemAppender extends AbstractAppender {

    static final int MAX_BUFFER_SIZE = 1000;

    private static volatile ProducerSink activeSink;
    private static final Queue<StreamEvent.LogRecord> bufferedRecords = new ConcurrentLinkedQueue<>();
    private static final AtomicLong sequence = new AtomicLong();
    private static volatile Level displayLevel = Level.INFO;
    private static final long START_TIME = System.currentTimeMillis();

    protected LogItemAppender(String name) {
        super(name, null, null, true, Property.EMPTY_ARRAY);
    }

    /**
     * Plugin factory used when the appender is declared in a Log4j 2 configuration.
     *
     * @param name appender name, defaults to {@code LogItemAppender}
     * @return a started appender
     */
    @PluginFactory
    public static LogItemAppender createAppender(@PluginAttribute("name") String name) {
        LogItemAppender appender = new LogItemAppender(Objects.requireNonNullElse(name, "LogItemAppender"));
        appender.start();
        return appender;
    }

    /**
     * Registers the sink that receives records from now on and flushes the records buffered
     * while no sink was active.
     *
     * @param sink the sink, or null to go back to buffering
     */
    public static void setActiveSink(ProducerSink sink) {
        activeSink = sink;
        if (sink != null) {
            StreamEvent.LogRecord record;
            while ((record = bufferedRecords.poll()) != null) {
                if (!sink.offer(record)) {
                    break;
                }
            }
        }
    }

    /**
     * Clears the active sink; later records are buffered again.
     */
    public static void clearActiveSink() {
        activeSink = null;
    }

    /**
     * Sets the lowest level that reaches the viewer. Events below it are discarded.
     */
    public static void setDisplayLevel(Level level) {
        displayLevel = Objects.requireNonNull(level, "level must not be null");
    }

    public static Level getDisplayLevel() {
        return displayLevel;
    }

    /**
     * Number of records waiting for a sink.
     */
    static int bufferedCount() {
        return bufferedRecords.size();
    }

    static void resetState() {
        activeSink = null;
        bufferedRecords.clear();
        displayLevel = Level.INFO;
    }

    @Override
    public void append(LogEvent event) {
        // lower intLevel is more severe
        if (event.getLevel().intLevel() > displayLevel.intLevel()) {
            return;
        }
        StreamEvent.LogRecord record = new StreamEvent.LogRecord(
                "log-" + sequence.incrementAndGet(), format(event));

        ProducerSink sink = activeSink;
        if (sink != null) {
            sink.offer(record);
        } else if (bufferedRecords.size() < MAX_BUFFER_SIZE) {
            bufferedRecords.offer(record);
        }
    }

    static String format(LogEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null) {
            int lastDot = loggerName.lastIndexOf('.');
            if (lastDot >= 0 && lastDot < loggerName.length() - 1) {
                loggerName = loggerName.substring(lastDot + 1);
            }
        }
        if (loggerName == null || loggerName.isEmpty()) {
            loggerName = "root";
        }

        long elapsedMs = Math.max(0, event.getTimeMillis() - START_TIME);
        long seconds = elapsedMs / 1000;
        String time = String.format("+%02d:%02d.%03d", seconds / 60, seconds % 60, elapsedMs % 1000);

        String text = String.format("[%s] [%-5s] %s - %s",
                time, event.getLevel(), loggerName, event.getMessage().getFormattedMessage());
        if (event.getThrown() != null) {
            text += "\n" + event.getThrown();
        }
        return text;
    }
}

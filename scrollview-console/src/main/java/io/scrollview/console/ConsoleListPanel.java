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

import io.scrollview.core.KeyPress;
import io.scrollview.core.ScrollList;
import io.scrollview.core.items.Expandable;
import io.scrollview.core.items.ScrollItem;
import io.scrollview.core.stream.EventChannel;
import io.scrollview.core.stream.ProducerSink;
import io.scrollview.core.stream.StreamMerger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Attributes;
import org.jline.terminal.Size;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.jline.utils.Display;
import org.jline.utils.InfoCmp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Full-screen JLine host for one {@link ScrollList}. The panel owns the terminal, a
 * {@link Display} for differential repaint, the list itself and an {@link EventChannel} through
 * which producers on other threads feed content.
 *
 * <p>Each tick of the pump ({@link #pumpOnce()}):
 * <ol>
 *   <li>drains pending events into the list through a {@link StreamMerger}</li>
 *   <li>reads keys and forwards them to the list, then to registered key handlers</li>
 *   <li>picks up terminal resizes</li>
 *   <li>paints the visible lines and a one-line status bar</li>
 * </ol>
 * {@link #start()} runs the pump on a daemon render thread at the configured refresh rate.
 * Tests drive {@link #pumpOnce()} directly instead.</p>
 *
 * <h2>Layout</h2>
 * <pre>
 * ┌────────────────────────────┐
 * │ list viewport (rows - 1)   │
 * ├────────────────────────────┤
 * │ 120/480  25% [follow]      │  status bar
 * └────────────────────────────┘
 * </pre>
 *
 * <h2>Keyboard</h2>
 * <p>While focused, page up/down and home/end go to the list. Up and down scroll one line,
 * enter toggles the selected item when it can expand. Keys nobody consumed are looked up in
 * the handlers registered with {@link Builder#withKeyHandler(String, Runnable)}.</p>
 *
 * <h2>Threading</h2>
 * <p>After {@link #start()} the list belongs to the render thread. Other threads feed content
 * through {@link #openSink(String)} and hand any other list work, such as a click on a row,
 * to {@link #runOnPump(Runnable)}. {@link #handleKey(KeyPress)},
 * {@link #toggleExpandedAtRow(int)} and {@link #pumpOnce()} throw
 * {@link IllegalStateException} when called from another thread while the render thread
 * runs. Key handlers and queued actions run on the render thread and may call them.</p>
 *
 * <pre>{@code
 * try (ConsoleListPanel panel = ConsoleListPanel.builder()
 *         .withRefreshRate(50, TimeUnit.MILLISECONDS)
 *         .build()) {
 *     ProducerSink sink = panel.openSink("agent");
 *     panel.start();
 *     sink.offer(new StreamEvent.TextDelta("msg-1", "Hello"));
 * }
 * }</pre>
 */
public class ConsoleListPanel implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ConsoleListPanel.class);

    static final Size DEFAULT_SIZE = new Size(100, 40);
    private static final int MAX_KEYS_PER_TICK = 64;
    private static final AttributedStyle STYLE_STATUS = AttributedStyle.DEFAULT.inverse();

    private final Terminal terminal;
    private final Display display;
    private final Attributes originalAttributes;
    private final boolean usingCustomTerminal;
    private final Size sizeOverride;
    private final long refreshRateMs;
    private final boolean useColors;
    private final boolean captureLogs;
    private final int maxEventsPerTick;
    private final Map<String, Runnable> keyHandlers;

    private final ScrollList list;
    private final EventChannel channel;
    private final StreamMerger merger;
    private final KeySequenceDecoder decoder;

    private final Queue<Runnable> pendingActions = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread renderThread;
    private volatile List<String> lastFrame = Collections.emptyList();
    private Size lastSize;

    private ConsoleListPanel(Builder builder) {
        this.usingCustomTerminal = builder.terminalOverride != null;
        this.sizeOverride = builder.sizeOverride;
        this.refreshRateMs = Math.max(1, builder.refreshRateMs);
        this.useColors = builder.useColors;
        this.captureLogs = builder.captureLogs;
        this.maxEventsPerTick = builder.maxEventsPerTick;
        this.keyHandlers = new HashMap<>(builder.keyHandlers);

        try {
            if (usingCustomTerminal) {
                this.terminal = builder.terminalOverride;
            } else {
                this.terminal = TerminalBuilder.builder()
                        .system(true)
                        .color(builder.useColors)
                        .build();
            }
            this.originalAttributes = terminal.enterRawMode();
            this.display = new Display(terminal, true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize JLine terminal: " + e.getMessage(), e);
        }

        this.list = ScrollList.builder()
                .withAutoScroll(builder.autoScroll)
                .withFocused(builder.focused)
                .withItemSeparators(builder.itemSeparators)
                .build();
        this.channel = new EventChannel(builder.channelCapacity);
        this.merger = new StreamMerger(list, builder.toolMaxLines);
        this.decoder = new KeySequenceDecoder(terminal.reader());

        syncSize();

        if (!usingCustomTerminal) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "ConsoleListPanel-Shutdown"));
            try {
                terminal.puts(InfoCmp.Capability.clear_screen);
                terminal.flush();
            } catch (RuntimeException e) {
                logger.warn("Could not clear screen: {}", e.getMessage());
            }
        }

        if (captureLogs) {
            LogItemAppender.setActiveSink(channel.openSink("log"));
        }
        logger.debug("Console panel ready at {}x{}", lastSize.getColumns(), lastSize.getRows());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens a producer sink on this panel's channel. Safe from any thread.
     */
    public ProducerSink openSink(String producerName) {
        return channel.openSink(producerName);
    }

    public EventChannel channel() {
        return channel;
    }

    /**
     * The hosted list. Only touch it from the thread that drives the pump: before
     * {@link #start()}, or inside key handlers and {@link #runOnPump(Runnable)} actions after.
     */
    public ScrollList list() {
        return list;
    }

    public StreamMerger merger() {
        return merger;
    }

    /**
     * Text of the last painted frame, one entry per terminal row.
     */
    public List<String> lastFrame() {
        return lastFrame;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Queues an action for the thread that drives the pump. Actions run in submission order at
     * the start of the next {@link #pumpOnce()}, before pending events are applied.
     *
     * @param action work on the list, e.g. {@code () -> panel.toggleExpandedAtRow(row)}
     * @return false if the panel is already closed and the action was dropped
     */
    public boolean runOnPump(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        if (closed.get()) {
            return false;
        }
        pendingActions.add(action);
        return true;
    }

    /**
     * Starts the render thread. Calling it again has no effect.
     */
    public synchronized void start() {
        if (renderThread != null || closed.get()) {
            return;
        }
        Thread thread = new Thread(this::renderLoop, "ConsoleListPanel-Renderer");
        thread.setDaemon(true);
        renderThread = thread;
        thread.start();
    }

    private void renderLoop() {
        logger.debug("Render loop started at {}ms refresh", refreshRateMs);
        try {
            while (!closed.get()) {
                try {
                    pumpOnce();
                } catch (RuntimeException e) {
                    logger.error("Render loop error: {}", e.getMessage(), e);
                }
                Thread.sleep(refreshRateMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            logger.debug("Render loop exited");
        }
    }

    /**
     * Runs one tick: run queued actions, apply pending events, handle keys, follow resizes and
     * repaint.
     */
    public void pumpOnce() {
        checkPumpThread("pumpOnce");
        if (closed.get()) {
            return;
        }
        runPendingActions();
        int applied = channel.drainTo(merger, maxEventsPerTick);
        if (applied > 0) {
            logger.trace("Applied {} events", applied);
        }
        readKeys();
        syncSize();
        paint();
    }

    private void runPendingActions() {
        Runnable action;
        while ((action = pendingActions.poll()) != null) {
            action.run();
        }
    }

    private void checkPumpThread(String operation) {
        Thread thread = renderThread;
        if (thread != null && thread.isAlive() && thread != Thread.currentThread()) {
            throw new IllegalStateException(operation + " must run on " + thread.getName()
                    + " once the panel is started, use runOnPump");
        }
    }

    private void readKeys() {
        try {
            for (int i = 0; i < MAX_KEYS_PER_TICK; i++) {
                Optional<KeyPress> key = decoder.next(1);
                if (key.isEmpty()) {
                    break;
                }
                handleKey(key.get());
            }
        } catch (IOException e) {
            logger.warn("Terminal read failed: {}", e.getMessage());
        }
    }

    /**
     * Dispatches one key: list navigation first, then line scrolling and expansion, then the
     * registered handlers. Pump thread only.
     *
     * @return true if something consumed the key
     */
    public boolean handleKey(KeyPress key) {
        checkPumpThread("handleKey");
        if (list.update(key)) {
            return true;
        }
        if (list.isFocused()) {
            switch (key.name()) {
                case "up" -> {
                    list.scrollBy(-1);
                    list.setAutoScroll(false);
                    return true;
                }
                case "down" -> {
                    list.scrollBy(1);
                    list.setAutoScroll(list.atBottom());
                    return true;
                }
                case "enter" -> {
                    return toggleExpanded(list.selectedIndex());
                }
                default -> {
                }
            }
        }
        Runnable handler = keyHandlers.get(key.name());
        if (handler != null) {
            handler.run();
            return true;
        }
        return false;
    }

    /**
     * Toggles the item drawn at a viewport row, as a mouse click would. Pump thread only;
     * other threads submit it through {@link #runOnPump(Runnable)}.
     *
     * @param row zero-based viewport row
     * @return true if an expandable item was toggled
     */
    public boolean toggleExpandedAtRow(int row) {
        checkPumpThread("toggleExpandedAtRow");
        return toggleExpanded(list.itemIndexAtRow(row));
    }

    private boolean toggleExpanded(int index) {
        if (index < 0 || index >= list.size()) {
            return false;
        }
        ScrollItem item = list.itemAt(index);
        if (item instanceof Expandable expandable) {
            expandable.toggleExpanded();
            list.contentChanged();
            return true;
        }
        return false;
    }

    private void syncSize() {
        Size size = currentSize();
        if (size.equals(lastSize)) {
            return;
        }
        if (lastSize != null) {
            logger.debug("Terminal resized {}x{} -> {}x{}",
                    lastSize.getColumns(), lastSize.getRows(), size.getColumns(), size.getRows());
        }
        lastSize = size;
        display.resize(size.getRows(), size.getColumns());
        display.clear();
        list.setSize(size.getColumns(), Math.max(0, size.getRows() - 1));
    }

    /**
     * Size to lay out for: the builder override, else what the terminal reports, else
     * {@code COLUMNS}/{@code LINES}, else 100x40.
     */
    Size currentSize() {
        if (sizeOverride != null) {
            return sizeOverride;
        }
        Size size = terminal.getSize();
        if (size != null && size.getRows() > 0 && size.getColumns() > 0) {
            return size;
        }
        Size fromEnv = sizeFromEnvironment(System.getenv("COLUMNS"), System.getenv("LINES"));
        return fromEnv != null ? fromEnv : DEFAULT_SIZE;
    }

    static Size sizeFromEnvironment(String columns, String lines) {
        if (columns == null || lines == null) {
            return null;
        }
        try {
            int cols = Integer.parseInt(columns.trim());
            int rows = Integer.parseInt(lines.trim());
            return cols > 0 && rows > 0 ? new Size(cols, rows) : null;
        } catch (NumberFormatException e) {
            logger.warn("Invalid COLUMNS/LINES environment variables: COLUMNS={}, LINES={}", columns, lines);
            return null;
        }
    }

    private void paint() {
        List<AttributedString> frame = renderFrame();
        display.update(frame, lastSize.cursorPos(lastSize.getRows() - 1, 0));
        terminal.flush();

        List<String> snapshot = new ArrayList<>(frame.size());
        for (AttributedString line : frame) {
            snapshot.add(line.toString());
        }
        lastFrame = Collections.unmodifiableList(snapshot);
    }

    /**
     * Builds the full screen: the list viewport padded to its height, then the status bar.
     * Every row is exactly as wide as the terminal, which {@link Display} needs for its
     * differential update.
     */
    List<AttributedString> renderFrame() {
        int width = lastSize.getColumns();
        int rows = lastSize.getRows();
        List<AttributedString> lines = new ArrayList<>(rows);

        for (String line : list.viewLines()) {
            lines.add(fit(new AttributedString(line), width));
        }
        AttributedString blank = new AttributedString(" ".repeat(width));
        while (lines.size() < rows - 1) {
            lines.add(blank);
        }
        if (rows > 0) {
            lines.add(renderStatusBar(width));
        }
        return lines;
    }

    private AttributedString renderStatusBar(int width) {
        String text = statusText();
        AttributedStringBuilder sb = new AttributedStringBuilder();
        if (useColors) {
            sb.style(STYLE_STATUS);
        }
        sb.append(text);
        return fit(sb.toAttributedString(), width);
    }

    /**
     * Status bar text: first visible line over total lines, scroll percent and whether the
     * view follows new content.
     */
    String statusText() {
        int total = list.totalLineCount();
        long first = total == 0 ? 0 : list.firstVisibleLine() + 1;
        int pct = (int) Math.round(list.scrollPercent() * 100);
        String text = String.format(Locale.ROOT, " %d/%d %3d%%", first, total, pct);
        if (list.isAutoScroll()) {
            text += " [follow]";
        }
        return text;
    }

    private static AttributedString fit(AttributedString line, int width) {
        int length = line.columnLength();
        if (length > width) {
            return line.columnSubSequence(0, width);
        }
        if (length < width) {
            AttributedStringBuilder sb = new AttributedStringBuilder(width);
            sb.append(line);
            sb.append(" ".repeat(width - length));
            return sb.toAttributedString();
        }
        return line;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (captureLogs) {
            LogItemAppender.clearActiveSink();
        }
        channel.close();
        pendingActions.clear();

        Thread thread = renderThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        try {
            display.update(Collections.emptyList(), 0);
            terminal.setAttributes(originalAttributes);
            terminal.flush();
            if (!usingCustomTerminal) {
                terminal.puts(InfoCmp.Capability.clear_screen);
                terminal.flush();
                terminal.close();
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Error during terminal cleanup", e);
        }
        logger.debug("Console panel closed");
    }

    /**
     * Builder for {@link ConsoleListPanel}.
     *
     * <p><strong>Defaults:</strong> system terminal, size from the terminal, 100ms refresh,
     * focused, colours on, separators on, auto-scroll on, no log capture, channel capacity
     * {@value EventChannel#DEFAULT_CAPACITY}, 1000 events per tick, tool output capped at 10
     * lines.</p>
     */
    public static class Builder {
        private Terminal terminalOverride;
        private Size sizeOverride;
        private long refreshRateMs = 100;
        private boolean focused = true;
        private boolean useColors = true;
        private boolean itemSeparators = true;
        private boolean autoScroll = true;
        private boolean captureLogs;
        private int channelCapacity = EventChannel.DEFAULT_CAPACITY;
        private int maxEventsPerTick = 1000;
        private int toolMaxLines = 10;
        private final Map<String, Runnable> keyHandlers = new HashMap<>();

        /**
         * Uses the given terminal instead of the system terminal. The panel does not close a
         * terminal it was given.
         */
        public Builder withTerminal(Terminal terminal) {
            this.terminalOverride = terminal;
            return this;
        }

        /**
         * Fixes the layout size, ignoring what the terminal reports.
         */
        public Builder withSize(int columns, int rows) {
            this.sizeOverride = new Size(Math.max(1, columns), Math.max(1, rows));
            return this;
        }

        public Builder withRefreshRate(long duration, TimeUnit unit) {
            this.refreshRateMs = unit.toMillis(duration);
            return this;
        }

        public Builder withRefreshRateMs(long refreshRateMs) {
            this.refreshRateMs = refreshRateMs;
            return this;
        }

        public Builder withFocused(boolean focused) {
            this.focused = focused;
            return this;
        }

        public Builder withColorOutput(boolean useColors) {
            this.useColors = useColors;
            return this;
        }

        public Builder withItemSeparators(boolean itemSeparators) {
            this.itemSeparators = itemSeparators;
            return this;
        }

        public Builder withAutoScroll(boolean autoScroll) {
            this.autoScroll = autoScroll;
            return this;
        }

        /**
         * Routes records from {@link LogItemAppender} into this panel while it is open.
         */
        public Builder withLogCapture(boolean captureLogs) {
            this.captureLogs = captureLogs;
            return this;
        }

        public Builder withChannelCapacity(int channelCapacity) {
            this.channelCapacity = channelCapacity;
            return this;
        }

        public Builder withMaxEventsPerTick(int maxEventsPerTick) {
            this.maxEventsPerTick = Math.max(1, maxEventsPerTick);
            return this;
        }

        public Builder withToolMaxLines(int toolMaxLines) {
            this.toolMaxLines = toolMaxLines;
            return this;
        }

        /**
         * Runs {@code handler} on the render thread when a key the list did not consume
         * arrives, e.g. {@code "q"} or {@code "esc"}.
         */
        public Builder withKeyHandler(String keyName, Runnable handler) {
            this.keyHandlers.put(keyName, Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        public ConsoleListPanel build() {
            return new ConsoleListPanel(this);
        }
    }
}

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

package io.scrollview.core;

import io.scrollview.core.cursor.LineHeights;
import io.scrollview.core.cursor.ScrollCursor;
import io.scrollview.core.items.ScrollItem;
import io.scrollview.core.text.TextLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lazily rendering, scroll-position-tracking list of variable-height {@link ScrollItem}s.
 * Only the items that intersect the viewport are rendered when the view is built; heights of
 * other items are resolved on demand when scroll arithmetic needs them.
 *
 * <p>Key Responsibilities:
 * <ul>
 *   <li><strong>Virtualized view:</strong> {@link #view()} renders from the cursor until the
 *       viewport height is filled, truncating the last visible item</li>
 *   <li><strong>Cursor:</strong> a {@link ScrollCursor} of (item index, line offset), moved by
 *       {@link #scrollBy(int)} and re-validated after every structural change</li>
 *   <li><strong>Auto-scroll:</strong> while enabled, every append or content change pins the
 *       view to the last {@code height} lines</li>
 *   <li><strong>Keyboard:</strong> page and home/end navigation via {@link #update(KeyPress)}
 *       while focused</li>
 * </ul>
 *
 * <h2>Resizing</h2>
 * <p>Changing the width never invalidates item caches. Scroll arithmetic keeps using each
 * item's last known height until the item is rendered again at the new width, so a resize
 * costs nothing for items outside the viewport. Only items without any known height are
 * rendered to measure them. Anchoring to the bottom and building the view lay out exactly the
 * items they show, at the current width.</p>
 *
 * <h2>Separators</h2>
 * <p>By default one blank line is drawn between consecutive items while there is room.
 * Separators are not part of the line arithmetic, so a bottom-anchored view that shows
 * several items can lose up to one trailing line per separator. Panels where every line
 * matters, such as a log viewer, disable them with
 * {@link Builder#withItemSeparators(boolean)}.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. All calls happen on the UI thread; producers running elsewhere hand
 * their content over through {@link io.scrollview.core.stream.EventChannel}.</p>
 *
 * <pre>{@code
 * ScrollList list = ScrollList.builder()
 *     .withSize(80, 20)
 *     .withItemSeparators(false)
 *     .build();
 * list.appendItem(new TextItem("text-0", "Hello"));
 * String frame = list.view();
 * }</pre>
 */
public class ScrollList {

    private static final Logger logger = LogManager.getLogger(ScrollList.class);

    private final List<ScrollItem> items = new ArrayList<>();
    private final List<ScrollItem> readOnlyItems = Collections.unmodifiableList(items);
    private final LineHeights heights = new ResolvingHeights();
    private final boolean itemSeparators;
    private final String selectionMarker;

    private ScrollCursor cursor = ScrollCursor.TOP;
    private int width;
    private int height;
    private boolean autoScroll;
    private boolean focused;
    private int selectedIndex = -1;

    /**
     * Creates a list with default options: auto-scroll on, unfocused, separators on.
     *
     * @param width initial viewport width, negative values become 0
     * @param height initial viewport height, negative values become 0
     */
    public ScrollList(int width, int height) {
        this(builder().withSize(width, height));
    }

    private ScrollList(Builder builder) {
        this.width = Math.max(0, builder.width);
        this.height = Math.max(0, builder.height);
        this.autoScroll = builder.autoScroll;
        this.focused = builder.focused;
        this.itemSeparators = builder.itemSeparators;
        this.selectionMarker = builder.selectionMarker;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---- item mutation -------------------------------------------------------------------

    /**
     * Replaces all items. The cursor is clamped to the new sequence and, when auto-scrolling,
     * re-anchored to the bottom. A selection that no longer exists is cleared.
     *
     * @param newItems the new items in display order
     */
    public void setItems(List<? extends ScrollItem> newItems) {
        Objects.requireNonNull(newItems, "items must not be null");
        List<ScrollItem> copy = new ArrayList<>(newItems.size());
        for (ScrollItem item : newItems) {
            copy.add(Objects.requireNonNull(item, "items must not contain null"));
        }
        int previous = items.size();
        items.clear();
        items.addAll(copy);
        if (selectedIndex >= items.size()) {
            selectedIndex = -1;
        }
        logger.debug("Replaced {} items with {}", previous, items.size());
        contentChanged();
    }

    /**
     * Appends an item. When auto-scrolling the view follows immediately so the new item is
     * visible without waiting for another tick.
     *
     * @param item the item to append
     */
    public void appendItem(ScrollItem item) {
        items.add(Objects.requireNonNull(item, "item must not be null"));
        if (autoScroll) {
            gotoBottom();
        }
    }

    /**
     * Replaces the item at {@code index} in place, keeping its position in the sequence.
     *
     * @param index position of the item to replace
     * @param item the replacement
     * @throws IndexOutOfBoundsException if index is not a valid position
     */
    public void replaceItem(int index, ScrollItem item) {
        Objects.checkIndex(index, items.size());
        items.set(index, Objects.requireNonNull(item, "item must not be null"));
        contentChanged();
    }

    /**
     * Removes all items and resets cursor and selection.
     */
    public void clear() {
        items.clear();
        cursor = ScrollCursor.TOP;
        selectedIndex = -1;
        logger.debug("Cleared scroll list");
    }

    /**
     * Must be called after an item was mutated and invalidated in place, or after any other
     * change that may have moved line boundaries. Clamps the cursor and follows the bottom
     * while auto-scrolling.
     */
    public void contentChanged() {
        clampOffset();
        if (autoScroll) {
            gotoBottom();
        }
    }

    /**
     * Index of the last item with the given id, or -1.
     */
    public int indexOf(String id) {
        for (int i = items.size() - 1; i >= 0; i--) {
            if (items.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    public ScrollItem itemAt(int index) {
        return items.get(index);
    }

    /**
     * Unmodifiable live view of the items.
     */
    public List<ScrollItem> items() {
        return readOnlyItems;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    // ---- viewport --------------------------------------------------------------------------

    /**
     * Sets the viewport width. Item caches are left alone; items re-layout lazily the next
     * time they are rendered.
     */
    public void setWidth(int width) {
        int clamped = Math.max(0, width);
        if (clamped == this.width) {
            return;
        }
        logger.debug("Width {} -> {}", this.width, clamped);
        this.width = clamped;
        contentChanged();
    }

    public void setHeight(int height) {
        int clamped = Math.max(0, height);
        if (clamped == this.height) {
            return;
        }
        logger.debug("Height {} -> {}", this.height, clamped);
        this.height = clamped;
        contentChanged();
    }

    public void setSize(int width, int height) {
        setWidth(width);
        setHeight(height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public void setAutoScroll(boolean enabled) {
        if (enabled != autoScroll) {
            logger.debug("Auto-scroll {}", enabled ? "enabled" : "disabled");
        }
        this.autoScroll = enabled;
    }

    public boolean isAutoScroll() {
        return autoScroll;
    }

    public void setFocused(boolean focused) {
        this.focused = focused;
    }

    public boolean isFocused() {
        return focused;
    }

    /**
     * Highlights an item. Indices outside the list, including -1, clear the selection.
     */
    public void setSelected(int index) {
        selectedIndex = index >= 0 && index < items.size() ? index : -1;
    }

    public int selectedIndex() {
        return selectedIndex;
    }

    public ScrollCursor cursor() {
        return cursor;
    }

    // ---- rendering -------------------------------------------------------------------------

    /**
     * Builds the visible frame as a single string with lines joined by line feeds.
     */
    public String view() {
        return String.join("\n", viewLines());
    }

    /**
     * Builds the visible frame, at most {@code height} lines. Starting at the cursor each item
     * is rendered at the current width; the first {@code lineOffset} lines of the first item
     * are skipped and the last item is cut at the viewport edge. The selected item's first
     * visible line carries the selection marker and is cut back to the width.
     *
     * @return the visible lines
     */
    public List<String> viewLines() {
        List<String> out = new ArrayList<>(height);
        if (items.isEmpty() || height == 0) {
            return out;
        }
        // the first item may still carry a height from another width
        clampOffset();
        items.get(cursor.itemIndex()).render(width);
        clampOffset();
        int first = cursor.itemIndex();
        for (int i = first; i < items.size() && out.size() < height; i++) {
            List<String> rendered = items.get(i).render(width);
            int skip = i == first ? cursor.lineOffset() : 0;
            if (skip >= rendered.size()) {
                continue;
            }
            boolean marked = false;
            for (int line = skip; line < rendered.size() && out.size() < height; line++) {
                String text = rendered.get(line);
                if (i == selectedIndex && !marked) {
                    text = TextLayout.truncate(selectionMarker + text, Math.max(1, width));
                    marked = true;
                }
                out.add(text);
            }
            if (itemSeparators && i < items.size() - 1 && out.size() < height) {
                out.add("");
            }
        }
        return out;
    }

    /**
     * Maps a row of the current view back to the item drawn there, for click handling.
     *
     * @param row zero-based row within the viewport
     * @return the item index, or -1 for separators, empty rows and rows outside the viewport
     */
    public int itemIndexAtRow(int row) {
        if (row < 0 || row >= height || items.isEmpty()) {
            return -1;
        }
        int first = cursor.itemIndex();
        int top = 0;
        for (int i = first; i < items.size() && top < height; i++) {
            int rendered = items.get(i).render(width).size();
            int visible = Math.max(0, rendered - (i == first ? cursor.lineOffset() : 0));
            if (visible == 0) {
                continue;
            }
            if (row < top + visible) {
                return i;
            }
            top += visible;
            if (itemSeparators && i < items.size() - 1) {
                if (row == top) {
                    return -1;
                }
                top++;
            }
        }
        return -1;
    }

    // ---- scrolling -------------------------------------------------------------------------

    /**
     * Scrolls by the given number of lines, positive for down. Out-of-range requests clamp.
     *
     * <p>Upward movement follows {@link ScrollCursor#scrollBy(int, LineHeights)} and stops at
     * the top. Downward movement stops earlier than the cursor arithmetic alone would: never
     * past the bottom-anchored position of {@link #gotoBottom()}, so the last page stays full
     * instead of scrolling the final item up to the first row. A cursor that already sits
     * below that position, because the viewport grew, does not move down.</p>
     *
     * @param lines lines to move, negative for up
     */
    public void scrollBy(int lines) {
        ScrollCursor next = cursor.scrollBy(lines, heights);
        if (lines > 0) {
            ScrollCursor bottom = ScrollCursor.bottomAnchored(heights, height);
            long bottomLine = bottom.absoluteLine(heights);
            long startLine = cursor.clamp(heights).absoluteLine(heights);
            if (next.absoluteLine(heights) > Math.max(startLine, bottomLine)) {
                next = startLine > bottomLine ? cursor.clamp(heights) : bottom;
            }
        }
        cursor = next;
    }

    public void gotoTop() {
        cursor = ScrollCursor.TOP;
    }

    /**
     * Positions the cursor so the last {@code height} lines are visible, or at the top when
     * everything fits. Only the items that end up visible are laid out at the current width.
     */
    public void gotoBottom() {
        cursor = ScrollCursor.bottomAnchored(heights, height);
        logger.trace("Anchored to bottom at {}", cursor);
    }

    public boolean atBottom() {
        return cursor.atBottom(heights, height);
    }

    /**
     * Total number of lines across all items by their last known heights, rendering only items
     * whose height is unknown.
     */
    public int totalLineCount() {
        return (int) Math.min(Integer.MAX_VALUE, ScrollCursor.totalLines(heights));
    }

    /**
     * Scroll position for indicators: 0 at the top, 1 at the bottom, 1 when everything fits
     * and 0 for an empty list.
     */
    public double scrollPercent() {
        if (items.isEmpty()) {
            return 0.0;
        }
        long total = ScrollCursor.totalLines(heights);
        if (total <= height) {
            return 1.0;
        }
        long maxOffset = total - height;
        double pct = (double) cursor.absoluteLine(heights) / maxOffset;
        return Math.max(0.0, Math.min(1.0, pct));
    }

    /**
     * Absolute index of the first visible line.
     */
    public long firstVisibleLine() {
        return cursor.absoluteLine(heights);
    }

    // ---- keyboard --------------------------------------------------------------------------

    /**
     * Handles navigation keys while focused: page up/down scroll by the viewport height, home
     * and end jump to the ends. Paging up or going home stops following new content; going to
     * the end, or paging down onto the bottom, resumes it.
     *
     * @param key the key forwarded by the owning panel
     * @return true if the key was consumed
     */
    public boolean update(KeyPress key) {
        if (!focused || key == null) {
            return false;
        }
        switch (key.name()) {
            case "pgup" -> {
                scrollBy(-height);
                setAutoScroll(false);
            }
            case "pgdown" -> {
                scrollBy(height);
                if (atBottom()) {
                    setAutoScroll(true);
                }
            }
            case "home" -> {
                gotoTop();
                setAutoScroll(false);
            }
            case "end" -> {
                gotoBottom();
                setAutoScroll(true);
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    /**
     * Re-validates the cursor against the current items. This is the single place that
     * guarantees the cursor invariant before the next view.
     */
    void clampOffset() {
        cursor = cursor.clamp(heights);
    }

    private final class ResolvingHeights implements LineHeights {
        @Override
        public int count() {
            return items.size();
        }

        /**
         * Last known height, from whatever width the item was rendered at. Only an item that
         * was never rendered, or was invalidated since, is laid out here.
         */
        @Override
        public int heightOf(int index) {
            ScrollItem item = items.get(index);
            int known = item.height();
            return known > 0 ? known : item.render(width).size();
        }

        @Override
        public int currentHeightOf(int index) {
            return items.get(index).render(width).size();
        }
    }

    /**
     * Builder for {@link ScrollList}. Defaults: 0x0 viewport, auto-scroll on, unfocused, blank
     * separator lines between items, {@code "▸ "} selection marker.
     */
    public static final class Builder {
        private int width;
        private int height;
        private boolean autoScroll = true;
        private boolean focused;
        private boolean itemSeparators = true;
        private String selectionMarker = "▸ ";

        private Builder() {
        }

        public Builder withSize(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder withAutoScroll(boolean autoScroll) {
            this.autoScroll = autoScroll;
            return this;
        }

        public Builder withFocused(boolean focused) {
            this.focused = focused;
            return this;
        }

        public Builder withItemSeparators(boolean itemSeparators) {
            this.itemSeparators = itemSeparators;
            return this;
        }

        public Builder withSelectionMarker(String selectionMarker) {
            this.selectionMarker = Objects.requireNonNull(selectionMarker, "selectionMarker must not be null");
            return this;
        }

        public ScrollList build() {
            return new ScrollList(this);
        }
    }
}

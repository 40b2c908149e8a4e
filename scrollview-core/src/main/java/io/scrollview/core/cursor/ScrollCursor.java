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

package io.scrollview.core.cursor;

/**
 * Two-part scroll position: the first visible item and how many of its leading lines are
 * scrolled off.
 *
 * <p>Instances are immutable and every operation is a pure function of the cursor and a
 * {@link LineHeights} view, so the stepping rules can be tested without rendering anything.
 * A cursor may be constructed out of range (for example after items were removed); callers
 * pass it through {@link #clamp(LineHeights)} before relying on it.</p>
 *
 * <p>Both scroll directions are exact line arithmetic: every step moves the absolute line
 * index by one. Stepping up out of an item lands on the last line of the previous one, and
 * empty items are crossed without consuming a line. As a consequence
 * {@code scrollBy(n)} followed by {@code scrollBy(-n)} returns to the starting cursor
 * whenever neither call hits the top or the end of the list.</p>
 *
 * @param itemIndex index of the first visible item
 * @param lineOffset number of leading lines of that item that are not shown
 */
public record ScrollCursor(int itemIndex, int lineOffset) {

    public static final ScrollCursor TOP = new ScrollCursor(0, 0);

    /**
     * Moves the cursor by the given number of lines, positive for down.
     *
     * <p>Scrolling down stops on the last line of the last item; scrolling up stops at
     * {@code (0, 0)}. Downward movement never decreases the absolute line.</p>
     *
     * @param deltaLines lines to move
     * @param heights the current item heights
     * @return the moved and clamped cursor
     */
    public ScrollCursor scrollBy(int deltaLines, LineHeights heights) {
        ScrollCursor start = clamp(heights);
        if (deltaLines == 0 || heights.count() == 0) {
            return start;
        }

        int count = heights.count();
        int idx = start.itemIndex;
        int offset = start.lineOffset;

        if (deltaLines > 0) {
            int lines = deltaLines;
            while (lines > 0 && idx < count) {
                int remaining = heights.heightOf(idx) - offset;
                if (lines >= remaining) {
                    idx++;
                    offset = 0;
                    lines -= remaining;
                } else {
                    offset += lines;
                    lines = 0;
                }
            }
            if (idx == count) {
                idx = count - 1;
                offset = Math.max(0, heights.heightOf(idx) - 1);
            } else {
                // land on the item that owns the line, not on an empty one before it
                while (offset == 0 && idx < count - 1 && heights.heightOf(idx) == 0) {
                    idx++;
                }
            }
        } else {
            int lines = deltaLines == Integer.MIN_VALUE ? Integer.MAX_VALUE : -deltaLines;
            while (lines > 0 && (idx > 0 || offset > 0)) {
                if (offset >= lines) {
                    offset -= lines;
                    lines = 0;
                } else {
                    lines -= offset;
                    offset = 0;
                    if (idx == 0) {
                        break;
                    }
                    idx--;
                    int previousHeight = heights.heightOf(idx);
                    if (previousHeight > 0) {
                        offset = previousHeight - 1;
                        lines--;
                    }
                }
            }
        }

        return new ScrollCursor(idx, offset).clamp(heights);
    }

    /**
     * Restores the cursor invariant against the current items: {@code 0 <= itemIndex < count}
     * (or {@code (0, 0)} when there are no items) and {@code 0 <= lineOffset < height} when the
     * item at {@code itemIndex} is not empty.
     *
     * @param heights the current item heights
     * @return this cursor if already valid, otherwise the nearest valid one
     */
    public ScrollCursor clamp(LineHeights heights) {
        int count = heights.count();
        if (count == 0) {
            return TOP;
        }
        int idx = Math.min(Math.max(itemIndex, 0), count - 1);
        int offset = Math.max(lineOffset, 0);
        int height = heights.heightOf(idx);
        if (offset >= height) {
            offset = Math.max(0, height - 1);
        }
        if (idx == itemIndex && offset == lineOffset) {
            return this;
        }
        return new ScrollCursor(idx, offset);
    }

    /**
     * Number of lines above the first visible line.
     *
     * @param heights the current item heights
     * @return the absolute line index of this cursor
     */
    public long absoluteLine(LineHeights heights) {
        long line = 0;
        int limit = Math.min(itemIndex, heights.count());
        for (int i = 0; i < limit; i++) {
            line += heights.heightOf(i);
        }
        return line + lineOffset;
    }

    /**
     * True when the viewport starting at this cursor reaches the last line. An empty list is
     * always at the bottom.
     *
     * @param heights the current item heights
     * @param viewportHeight the number of visible lines
     * @return whether the last line is visible
     */
    public boolean atBottom(LineHeights heights, int viewportHeight) {
        if (heights.count() == 0) {
            return true;
        }
        return absoluteLine(heights) + Math.max(0, viewportHeight) >= totalLines(heights);
    }

    /**
     * Cursor that shows the last {@code viewportHeight} lines, or the top when everything fits.
     * Walks backwards from the last item and stops as soon as the viewport is filled, so only
     * the items that end up visible are consulted, through {@link LineHeights#currentHeightOf(int)}.
     *
     * @param heights the current item heights
     * @param viewportHeight the number of visible lines
     * @return the bottom-anchored cursor
     */
    public static ScrollCursor bottomAnchored(LineHeights heights, int viewportHeight) {
        int viewport = Math.max(0, viewportHeight);
        long below = 0;
        for (int i = heights.count() - 1; i >= 0; i--) {
            int height = heights.currentHeightOf(i);
            below += height;
            if (height > 0 && below >= viewport) {
                return new ScrollCursor(i, (int) Math.min(height - 1, below - viewport));
            }
        }
        return TOP;
    }

    /**
     * Sum of all item heights.
     */
    public static long totalLines(LineHeights heights) {
        long total = 0;
        for (int i = 0; i < heights.count(); i++) {
            total += heights.heightOf(i);
        }
        return total;
    }
}

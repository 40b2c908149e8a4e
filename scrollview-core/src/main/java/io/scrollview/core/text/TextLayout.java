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

package io.scrollview.core.text;

import org.jline.utils.WCWidth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column-aware text helpers used by item renderers. Widths are measured in terminal
 * columns using JLine's {@link WCWidth} tables, so wide CJK glyphs count as two columns and
 * combining marks as zero.
 *
 * <p>This is deliberately small: items wrap plain text and pad or truncate single lines.
 * There is no hyphenation and no bidi handling.</p>
 */
public final class TextLayout {

    private static final String ELLIPSIS = "…";

    private TextLayout() {
        throw new UnsupportedOperationException("Utility class should not be instantiated");
    }

    /**
     * Returns the number of terminal columns the string occupies.
     *
     * @param text the text to measure, may be null
     * @return the column width, 0 for null or empty text
     */
    public static int displayWidth(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int width = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            width += columnsOf(cp);
            i += Character.charCount(cp);
        }
        return width;
    }

    /**
     * Splits text on line feeds, keeping empty lines. A trailing line feed yields a trailing
     * empty line, matching how a terminal would show it.
     *
     * @param text the text to split, null is treated as empty
     * @return at least one line
     */
    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of("");
        }
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(stripCarriageReturn(text.substring(start, i)));
                start = i + 1;
            }
        }
        lines.add(stripCarriageReturn(text.substring(start)));
        return lines;
    }

    /**
     * Word-wraps text to the given column width. Existing line feeds are kept; each source line
     * is broken at the last space that fits, or hard-broken by columns when a single word is
     * wider than the limit. Leading spaces of continuation lines are dropped.
     *
     * @param text the text to wrap, null is treated as empty
     * @param width the column limit; values below 1 return the source lines unwrapped
     * @return the wrapped lines, never empty
     */
    public static List<String> wrap(String text, int width) {
        List<String> source = splitLines(text);
        if (width < 1) {
            return source;
        }
        List<String> wrapped = new ArrayList<>(source.size());
        for (String line : source) {
            wrapLine(line, width, wrapped);
        }
        return wrapped;
    }

    private static void wrapLine(String line, int width, List<String> out) {
        String remaining = line;
        while (displayWidth(remaining) > width) {
            int fitEnd = indexAfterColumns(remaining, width);
            int breakAt = remaining.lastIndexOf(' ', fitEnd);
            String head;
            String tail;
            if (breakAt > 0) {
                head = remaining.substring(0, breakAt);
                tail = remaining.substring(breakAt + 1);
            } else {
                // a single glyph wider than the limit still has to make progress
                int cut = Math.max(fitEnd, Character.charCount(remaining.codePointAt(0)));
                head = remaining.substring(0, cut);
                tail = remaining.substring(cut);
            }
            out.add(stripTrailing(head));
            remaining = stripLeading(tail);
        }
        out.add(remaining);
    }

    /**
     * Cuts a single line to fit the column width, marking the cut with an ellipsis when there
     * is room for one.
     *
     * @param line the line to truncate
     * @param width the column limit
     * @return the line unchanged if it fits, otherwise a shortened copy
     */
    public static String truncate(String line, int width) {
        return truncate(line, width, ELLIPSIS);
    }

    /**
     * Cuts a single line to fit the column width using the given marker, which is only added
     * when the width is larger than three columns.
     *
     * @param line the line to truncate
     * @param width the column limit
     * @param marker the text appended to a cut line, such as {@code "..."}
     * @return the line unchanged if it fits, otherwise a shortened copy
     */
    public static String truncate(String line, int width, String marker) {
        if (line == null || width <= 0) {
            return "";
        }
        if (displayWidth(line) <= width) {
            return line;
        }
        int markerWidth = displayWidth(marker);
        if (width > 3 && markerWidth < width) {
            return line.substring(0, indexAfterColumns(line, width - markerWidth)) + marker;
        }
        return line.substring(0, indexAfterColumns(line, width));
    }

    /**
     * Pads a line with spaces on the left so it ends at the given column.
     *
     * @param line the line to align
     * @param width the target column width
     * @return the padded line, or the line unchanged when it is already wider
     */
    public static String padLeft(String line, int width) {
        int missing = width - displayWidth(line);
        return missing > 0 ? " ".repeat(missing) + line : line;
    }

    /**
     * Pads a line with spaces on the right to the given column width.
     *
     * @param line the line to pad
     * @param width the target column width
     * @return the padded line, or the line unchanged when it is already wider
     */
    public static String padRight(String line, int width) {
        int missing = width - displayWidth(line);
        return missing > 0 ? line + " ".repeat(missing) : line;
    }

    /**
     * Returns an unmodifiable copy suitable for caching.
     */
    public static List<String> freeze(List<String> lines) {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    private static int indexAfterColumns(String text, int columns) {
        int used = 0;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int w = columnsOf(cp);
            if (used + w > columns) {
                break;
            }
            used += w;
            i += Character.charCount(cp);
        }
        return i;
    }

    private static int columnsOf(int codePoint) {
        return Math.max(0, WCWidth.wcwidth(codePoint));
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == ' ') {
            i++;
        }
        return s.substring(i);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ' ') {
            end--;
        }
        return s.substring(0, end);
    }
}

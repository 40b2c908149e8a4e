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
 * Read view of item heights used by {@link ScrollCursor} arithmetic.
 *
 * <p>Implementations backed by live items resolve unknown heights on demand, typically by
 * rendering the item at the current width. A height of 0 returned from here means the item
 * really is empty.</p>
 */
public interface LineHeights {

    /**
     * Number of items.
     */
    int count();

    /**
     * Resolved height of the item at {@code index}, {@code 0 <= index < count()}.
     */
    int heightOf(int index);

    /**
     * Height at the current layout width. Implementations that keep heights from an earlier
     * width lay the item out again here. Only called for the few items at the end of the list
     * when anchoring to the bottom.
     */
    default int currentHeightOf(int index) {
        return heightOf(index);
    }

    /**
     * Fixed heights, mostly useful for testing cursor arithmetic without rendering.
     *
     * @param heights the height of each item in display order
     * @return a view over a copy of the heights
     */
    static LineHeights of(int... heights) {
        int[] copy = heights.clone();
        return new LineHeights() {
            @Override
            public int count() {
                return copy.length;
            }

            @Override
            public int heightOf(int index) {
                return copy[index];
            }
        };
    }
}

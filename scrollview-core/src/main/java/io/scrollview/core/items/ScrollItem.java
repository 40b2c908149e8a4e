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

package io.scrollview.core.items;

import java.util.List;

/**
 * One unit of content in a {@link io.scrollview.core.ScrollList}: an assistant text block, a
 * tool invocation, a thinking block, a divider, an info line and so on.
 *
 * <p>The set of item kinds is closed. Each kind keeps its own state and decides in
 * {@link #render(int)} how that state looks at a given width; truncation thresholds, icons
 * and expand/collapse behaviour live entirely inside the variant.</p>
 *
 * <h2>Render contract</h2>
 * <ul>
 *   <li>{@link #render(int)} returns cached lines when the cache is valid for that width and
 *       performs no layout work in that case. Otherwise it lays out, stores and returns.</li>
 *   <li>{@link #height()} returns the cached line count when valid for some width, otherwise
 *       {@code 0}. Zero means "unknown": callers that need a real height render first.</li>
 *   <li>{@link #invalidate()} marks the cache stale. Every state mutator of a variant calls
 *       it, so producers only call it directly after mutating through some other path.</li>
 * </ul>
 *
 * <p>Items never reference the list that holds them.</p>
 */
public sealed interface ScrollItem
        permits TextItem, UserItem, ThinkingItem, ToolItem, HookItem, SubagentItem, InfoItem, DividerItem, LogItem {

    /**
     * Stable identity used to find and mutate an existing item instead of appending a
     * duplicate when streamed updates arrive for the same logical unit.
     */
    String id();

    /**
     * Returns the display lines for the given width, computing them only on a cache miss.
     *
     * @param width the available columns; values below 1 are laid out as 1
     * @return the rendered lines, unmodifiable
     */
    List<String> render(int width);

    /**
     * Returns the number of lines of the last valid render, or 0 when unknown.
     */
    int height();

    /**
     * Marks the cached render stale without discarding it.
     */
    void invalidate();

    /**
     * Number of layout computations performed by this item so far.
     */
    long renderCount();
}

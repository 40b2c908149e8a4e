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

import io.scrollview.core.text.TextLayout;

import java.util.List;

/**
 * Per-item memo of the last render, keyed by width only.
 *
 * <p>Invariant: when {@link #isValid()} is true, {@link #height()} equals the size of
 * {@link #lines()} and both were computed for {@link #width()}. Invalidation keeps the previous
 * lines around but {@link #height()} reports 0 until the next store, so a caller that needs an
 * authoritative height renders first.</p>
 *
 * <p>A viewport resize never touches the cache. The next render request at a different width
 * misses and recomputes, which is how the cost of a resize is paid only by items that are
 * actually drawn again.</p>
 */
public final class RenderCache {

    private int width = -1;
    private List<String> lines = List.of();
    private boolean valid;
    private long recomputes;

    /**
     * Returns true if the cached lines were computed for exactly this width and nothing has
     * been invalidated since.
     */
    public boolean isValidFor(int width) {
        return valid && this.width == width;
    }

    public boolean isValid() {
        return valid;
    }

    public int width() {
        return width;
    }

    public List<String> lines() {
        return lines;
    }

    /**
     * Height of the last valid render, or 0 when unknown.
     */
    public int height() {
        return valid ? lines.size() : 0;
    }

    /**
     * Stores freshly computed lines for a width and marks the cache valid.
     *
     * @param width the width the lines were laid out for
     * @param rendered the rendered lines; copied defensively
     * @return the stored, unmodifiable lines
     */
    public List<String> store(int width, List<String> rendered) {
        this.lines = TextLayout.freeze(rendered);
        this.width = width;
        this.valid = true;
        this.recomputes++;
        return this.lines;
    }

    public void invalidate() {
        this.valid = false;
    }

    /**
     * Number of times lines were computed and stored. Never decreases.
     */
    public long recomputes() {
        return recomputes;
    }
}

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
import java.util.Objects;

/**
 * Shared cache handling for the item variants. Subclasses implement {@link #layout(int)} and
 * call {@link #invalidate()} from every mutator.
 */
abstract class AbstractScrollItem {

    private final String id;
    private final RenderCache cache = new RenderCache();

    protected AbstractScrollItem(String id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public final String id() {
        return id;
    }

    public final List<String> render(int width) {
        int effective = Math.max(1, width);
        if (cache.isValidFor(effective)) {
            return cache.lines();
        }
        return cache.store(effective, layout(effective));
    }

    public final int height() {
        return cache.height();
    }

    public final void invalidate() {
        cache.invalidate();
    }

    public final long renderCount() {
        return cache.recomputes();
    }

    /**
     * Computes fresh lines for the width. Must be free of side effects other than reading the
     * item's own state.
     *
     * @param width the available columns, at least 1
     * @return the lines to cache, at least one
     */
    protected abstract List<String> layout(int width);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assistant text. Content is wrapped at {@code min(width - 2, 120)} columns and each line
 * carries a left border.
 *
 * <p>Streaming producers grow the content with {@link #append(String)}; the item keeps its
 * identity so the list does not grow per delta.</p>
 */
public final class TextItem extends AbstractScrollItem implements ScrollItem {

    static final int MAX_CONTENT_WIDTH = 120;
    static final String BORDER = "│ ";

    private String content;

    public TextItem(String id, String content) {
        super(id);
        this.content = Objects.requireNonNullElse(content, "");
    }

    public String content() {
        return content;
    }

    /**
     * Appends a streamed delta. Empty deltas leave the cache untouched.
     *
     * @param delta text to append, may be null
     */
    public void append(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        content = content + delta;
        invalidate();
    }

    public void setContent(String content) {
        this.content = Objects.requireNonNullElse(content, "");
        invalidate();
    }

    @Override
    protected List<String> layout(int width) {
        int contentWidth = Math.max(1, Math.min(width - BORDER.length(), MAX_CONTENT_WIDTH));
        List<String> wrapped = TextLayout.wrap(content, contentWidth);
        List<String> lines = new ArrayList<>(wrapped.size());
        for (String line : wrapped) {
            lines.add(BORDER + line);
        }
        return lines;
    }
}

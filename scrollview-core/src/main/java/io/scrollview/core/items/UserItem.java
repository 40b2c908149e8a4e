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
 * Text typed by the user. Wrapped like {@link TextItem}, but bordered on the right and
 * right-aligned to the full width.
 */
public final class UserItem extends AbstractScrollItem implements ScrollItem {

    private static final String BORDER = " │";

    private String content;

    public UserItem(String id, String content) {
        super(id);
        this.content = Objects.requireNonNullElse(content, "");
    }

    public String content() {
        return content;
    }

    public void append(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        content = content + delta;
        invalidate();
    }

    @Override
    protected List<String> layout(int width) {
        int contentWidth = Math.max(1, Math.min(width - BORDER.length(), TextItem.MAX_CONTENT_WIDTH));
        List<String> wrapped = TextLayout.wrap(content, contentWidth);
        int blockWidth = 0;
        for (String line : wrapped) {
            blockWidth = Math.max(blockWidth, TextLayout.displayWidth(line));
        }
        List<String> lines = new ArrayList<>(wrapped.size());
        for (String line : wrapped) {
            String bordered = TextLayout.padRight(line, blockWidth) + BORDER;
            lines.add(TextLayout.padLeft(bordered, width));
        }
        return lines;
    }
}

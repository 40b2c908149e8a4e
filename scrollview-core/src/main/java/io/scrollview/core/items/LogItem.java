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
 * A single log record in a log viewer. Long records wrap, with continuation lines indented
 * two columns so record boundaries stay visible.
 */
public final class LogItem extends AbstractScrollItem implements ScrollItem {

    private static final String CONTINUATION = "  ";

    private final String text;

    public LogItem(String id, String text) {
        super(id);
        this.text = Objects.requireNonNullElse(text, "");
    }

    public String text() {
        return text;
    }

    @Override
    protected List<String> layout(int width) {
        List<String> lines = new ArrayList<>();
        int continuationWidth = Math.max(1, width - CONTINUATION.length());
        for (String source : TextLayout.splitLines(text)) {
            String first = TextLayout.wrap(source, width).get(0);
            lines.add(first);
            String rest = source.substring(first.length()).stripLeading();
            if (!rest.isEmpty()) {
                for (String continued : TextLayout.wrap(rest, continuationWidth)) {
                    lines.add(CONTINUATION + continued);
                }
            }
        }
        return lines;
    }
}

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
 * Horizontal rule with a centred iteration label. Each side rule is at least three columns,
 * so very narrow widths are cut rather than dropping the label.
 */
public final class DividerItem extends AbstractScrollItem implements ScrollItem {

    private static final int MIN_RULE = 3;

    private final int iteration;

    public DividerItem(String id, int iteration) {
        super(id);
        this.iteration = iteration;
    }

    public int iteration() {
        return iteration;
    }

    @Override
    protected List<String> layout(int width) {
        String label = " Iteration #" + iteration + " ";
        int rule = Math.max(MIN_RULE, (width - TextLayout.displayWidth(label)) / 2);
        String line = "─".repeat(rule) + label + "─".repeat(rule);
        return List.of(TextLayout.truncate(line, width, ""));
    }
}

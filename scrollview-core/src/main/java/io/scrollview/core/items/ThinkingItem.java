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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Agent reasoning. Collapsed by default: when there are more than {@value #COLLAPSED_LINES}
 * source lines only the most recent ones are shown, below a hint counting the hidden ones.
 * Once finished with a positive duration a {@code Thought for ...} footer is added.
 */
public final class ThinkingItem extends AbstractScrollItem implements ScrollItem, Expandable {

    static final int COLLAPSED_LINES = 10;
    private static final String INDENT = "  ";

    private String content;
    private boolean collapsed = true;
    private boolean finished;
    private Duration duration = Duration.ZERO;

    public ThinkingItem(String id, String content) {
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

    /**
     * Marks the reasoning as complete.
     *
     * @param duration how long the agent spent thinking, may be null
     */
    public void finish(Duration duration) {
        this.finished = true;
        this.duration = Objects.requireNonNullElse(duration, Duration.ZERO);
        invalidate();
    }

    public boolean isFinished() {
        return finished;
    }

    public Duration duration() {
        return duration;
    }

    @Override
    public boolean isExpanded() {
        return !collapsed;
    }

    @Override
    public void toggleExpanded() {
        collapsed = !collapsed;
        invalidate();
    }

    @Override
    protected List<String> layout(int width) {
        List<String> source = TextLayout.splitLines(content);
        int hidden = 0;
        if (collapsed && source.size() > COLLAPSED_LINES) {
            hidden = source.size() - COLLAPSED_LINES;
            source = source.subList(hidden, source.size());
        }

        int contentWidth = Math.max(1, width - INDENT.length());
        List<String> lines = new ArrayList<>();
        if (hidden > 0) {
            lines.add(INDENT + "… (" + hidden + " lines hidden)");
        }
        for (String line : source) {
            for (String wrapped : TextLayout.wrap(line, contentWidth)) {
                lines.add(INDENT + wrapped);
            }
        }
        if (finished && !duration.isZero() && !duration.isNegative()) {
            lines.add(INDENT + "Thought for " + Durations.format(duration));
        }
        return lines;
    }
}

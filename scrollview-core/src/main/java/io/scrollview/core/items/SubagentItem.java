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
 * A tool call that spawned a subagent. Drawn as a small box holding the subagent type, its
 * status and the task description. Once the subagent's session id is known the box offers a
 * hint that the session can be opened for replay.
 */
public final class SubagentItem extends AbstractScrollItem implements ScrollItem {

    private static final String INDENT = "  ";
    private static final int MIN_BOX_WIDTH = 20;

    private final String subagentType;
    private final String description;
    private ToolStatus status;
    private String sessionId;

    public SubagentItem(String id, String subagentType, String description, ToolStatus status, String sessionId) {
        super(id);
        this.subagentType = Objects.requireNonNullElse(subagentType, "");
        this.description = Objects.requireNonNullElse(description, "");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.sessionId = Objects.requireNonNullElse(sessionId, "");
    }

    public String subagentType() {
        return subagentType;
    }

    public String description() {
        return description;
    }

    public ToolStatus status() {
        return status;
    }

    public String sessionId() {
        return sessionId;
    }

    public void setStatus(ToolStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        invalidate();
    }

    /**
     * Records the session id once the subagent has one. Null or empty ids are ignored so a
     * later update without an id does not erase it.
     */
    public void setSessionId(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return;
        }
        this.sessionId = sessionId;
        invalidate();
    }

    @Override
    protected List<String> layout(int width) {
        int boxWidth = Math.max(MIN_BOX_WIDTH, width - 4);
        int innerWidth = boxWidth - 4;

        List<String> content = new ArrayList<>();
        content.add(status.icon() + " [" + subagentType + "] " + statusText());
        for (String line : TextLayout.wrap(description, innerWidth - INDENT.length())) {
            content.add(INDENT + line);
        }
        if (!sessionId.isEmpty()) {
            content.add("");
            content.add("[Click to view]");
        }

        List<String> lines = new ArrayList<>(content.size() + 2);
        lines.add(INDENT + "┌" + "─".repeat(boxWidth - 2) + "┐");
        for (String line : content) {
            String cell = TextLayout.padRight(TextLayout.truncate(line, innerWidth), innerWidth);
            lines.add(INDENT + "│ " + cell + " │");
        }
        lines.add(INDENT + "└" + "─".repeat(boxWidth - 2) + "┘");
        return lines;
    }

    private String statusText() {
        return switch (status) {
            case PENDING -> "Pending";
            case RUNNING -> "Running...";
            case SUCCESS -> "Completed";
            case ERROR -> "Error";
            case CANCELED -> "Canceled";
        };
    }
}

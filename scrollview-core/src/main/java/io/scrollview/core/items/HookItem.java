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
 * A lifecycle hook command run around an agent iteration, such as a {@code pre_iteration}
 * script. Starts out running and collapsed; {@link #finish(ToolStatus, String, Duration)}
 * records the outcome in place.
 *
 * <p>The header shows the status icon, the hook type and the command, plus the run time once
 * finished. Output follows after a blank line and is capped like tool output: at most
 * {@code maxLines} lines while collapsed, everything when expanded or failed.</p>
 */
public final class HookItem extends AbstractScrollItem implements ScrollItem, Expandable {

    static final int DEFAULT_MAX_LINES = 10;
    private static final String INDENT = "  ";

    private final String hookType;
    private final String command;
    private final int maxLines;
    private ToolStatus status = ToolStatus.RUNNING;
    private String output = "";
    private Duration duration = Duration.ZERO;
    private boolean expanded;

    public HookItem(String id, String hookType, String command) {
        this(id, hookType, command, DEFAULT_MAX_LINES);
    }

    /**
     * @param id item identity, usually the hook run id
     * @param hookType lifecycle phase, e.g. {@code session_start}
     * @param command the command line being run
     * @param maxLines output lines shown while collapsed, at least 1
     */
    public HookItem(String id, String hookType, String command, int maxLines) {
        super(id);
        this.hookType = Objects.requireNonNullElse(hookType, "");
        this.command = Objects.requireNonNullElse(command, "");
        this.maxLines = Math.max(1, maxLines);
    }

    public String hookType() {
        return hookType;
    }

    public String command() {
        return command;
    }

    public ToolStatus status() {
        return status;
    }

    public String output() {
        return output;
    }

    public Duration duration() {
        return duration;
    }

    public int maxLines() {
        return maxLines;
    }

    /**
     * Records the result of the hook run.
     *
     * @param status final status, usually {@link ToolStatus#SUCCESS} or {@link ToolStatus#ERROR}
     * @param output combined command output, may be null
     * @param duration how long the command ran, may be null
     */
    public void finish(ToolStatus status, String output, Duration duration) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.output = Objects.requireNonNullElse(output, "");
        this.duration = Objects.requireNonNullElse(duration, Duration.ZERO);
        invalidate();
    }

    @Override
    public boolean isExpanded() {
        return expanded;
    }

    @Override
    public void toggleExpanded() {
        expanded = !expanded;
        invalidate();
    }

    @Override
    protected List<String> layout(int width) {
        List<String> lines = new ArrayList<>();
        lines.add(header(width));

        if (output.isEmpty()) {
            return lines;
        }

        lines.add("");
        List<String> outputLines = TextLayout.splitLines(output);
        List<String> visible = outputLines;
        int hidden = 0;
        if (status != ToolStatus.ERROR && !expanded && outputLines.size() > maxLines) {
            visible = outputLines.subList(0, maxLines);
            hidden = outputLines.size() - maxLines;
        }
        int outputWidth = Math.max(1, width - INDENT.length());
        for (String line : visible) {
            for (String wrapped : TextLayout.wrap(line, outputWidth)) {
                lines.add(INDENT + wrapped);
            }
        }
        if (hidden > 0) {
            lines.add(INDENT + "…(" + hidden + " more lines, click to expand)");
        }
        return lines;
    }

    private String header(int width) {
        String prefix = INDENT + status.icon() + " Hook " + hookType;
        String suffix = status.isActive() || duration.isZero() ? "" : " (" + Durations.format(duration) + ")";
        if (command.isEmpty()) {
            return TextLayout.truncate(prefix + suffix, width);
        }
        int room = width - TextLayout.displayWidth(prefix) - TextLayout.displayWidth(suffix) - 2;
        if (room < 4) {
            return TextLayout.truncate(prefix + suffix, width);
        }
        String flat = command.replace('\n', ' ');
        return prefix + ": " + TextLayout.truncate(flat, room, "...") + suffix;
    }
}

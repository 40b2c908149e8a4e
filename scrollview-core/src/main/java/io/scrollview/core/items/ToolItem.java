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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A tool invocation: a header with status icon, tool name and formatted parameters, followed
 * by the tool output.
 *
 * <p>Output is capped at {@code maxLines} lines unless the item is expanded or the tool
 * failed, in which case everything is shown. A truncated body ends with a hint counting the
 * hidden lines.</p>
 *
 * <pre>{@code
 * ToolItem item = ToolItem.builder("call-1")
 *     .withTitle("bash")
 *     .withStatus(ToolStatus.RUNNING)
 *     .withInput(Map.of("command", "ls -la"))
 *     .build();
 * }</pre>
 */
public final class ToolItem extends AbstractScrollItem implements ScrollItem, Expandable {

    private static final String INDENT = "  ";
    private static final int MIN_PARAM_WIDTH = 10;

    private final int maxLines;
    private String title;
    private String kind;
    private ToolStatus status;
    private Map<String, Object> input;
    private String output;
    private boolean expanded;

    private ToolItem(Builder builder) {
        super(builder.id);
        this.title = builder.title;
        this.kind = builder.kind;
        this.status = builder.status;
        this.input = copyOf(builder.input);
        this.output = builder.output;
        this.maxLines = builder.maxLines;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String title() {
        return title;
    }

    public String kind() {
        return kind;
    }

    public ToolStatus status() {
        return status;
    }

    public Map<String, Object> input() {
        return input;
    }

    public String output() {
        return output;
    }

    public int maxLines() {
        return maxLines;
    }

    public void setStatus(ToolStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        invalidate();
    }

    public void setKind(String kind) {
        this.kind = Objects.requireNonNullElse(kind, "");
        invalidate();
    }

    public void setTitle(String title) {
        this.title = Objects.requireNonNullElse(title, "");
        invalidate();
    }

    public void setInput(Map<String, Object> input) {
        this.input = copyOf(input);
        invalidate();
    }

    public void setOutput(String output) {
        this.output = Objects.requireNonNullElse(output, "");
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
        lines.add(TextLayout.truncate(header(width), width));

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
        String displayName = capitalize(title);
        String header = INDENT + status.icon() + " " + displayName;
        if (input.isEmpty()) {
            return header;
        }

        // edit and write tools show the file in the header, the rest belongs to the body
        Map<String, Object> params = input;
        if ("edit".equals(kind) || (input.containsKey("content") && input.containsKey("filePath"))) {
            params = input.containsKey("filePath")
                    ? Collections.singletonMap("filePath", input.get("filePath"))
                    : Map.of();
        }

        int paramWidth = Math.max(MIN_PARAM_WIDTH, width - TextLayout.displayWidth(header) - 1);
        String formatted = formatParams(params, paramWidth);
        return formatted.isEmpty() ? header : header + " " + formatted;
    }

    /**
     * Formats tool parameters as {@code primary (key=value, ...)} where the primary value is
     * {@code command} or {@code filePath}. Remaining keys are sorted for a stable layout.
     */
    static String formatParams(Map<String, Object> params, int maxWidth) {
        if (params.isEmpty()) {
            return "";
        }
        String primaryKey = params.containsKey("command") ? "command"
                : params.containsKey("filePath") ? "filePath" : null;

        StringBuilder sb = new StringBuilder();
        if (primaryKey != null) {
            sb.append(params.get(primaryKey));
        }
        List<String> remaining = new ArrayList<>();
        for (Map.Entry<String, Object> entry : new TreeMap<>(params).entrySet()) {
            if (!entry.getKey().equals(primaryKey)) {
                remaining.add(entry.getKey() + "=" + entry.getValue());
            }
        }
        if (!remaining.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append('(').append(String.join(", ", remaining)).append(')');
        }
        String flat = sb.toString().replace('\n', ' ');
        return TextLayout.truncate(flat, maxWidth, "...");
    }

    private static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static Map<String, Object> copyOf(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        // values may be null when decoded from loose producer payloads
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    /**
     * Builder for {@link ToolItem}. Defaults: empty title and kind, {@link ToolStatus#PENDING},
     * no input, no output, at most 10 output lines while collapsed.
     */
    public static final class Builder {
        private final String id;
        private String title = "";
        private String kind = "";
        private ToolStatus status = ToolStatus.PENDING;
        private Map<String, Object> input = Map.of();
        private String output = "";
        private int maxLines = 10;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder withTitle(String title) {
            this.title = Objects.requireNonNullElse(title, "");
            return this;
        }

        public Builder withKind(String kind) {
            this.kind = Objects.requireNonNullElse(kind, "");
            return this;
        }

        public Builder withStatus(ToolStatus status) {
            this.status = Objects.requireNonNull(status, "status must not be null");
            return this;
        }

        public Builder withInput(Map<String, Object> input) {
            this.input = input;
            return this;
        }

        public Builder withOutput(String output) {
            this.output = Objects.requireNonNullElse(output, "");
            return this;
        }

        /**
         * Sets how many output lines are shown while collapsed. Values below 1 are raised to 1.
         */
        public Builder withMaxLines(int maxLines) {
            this.maxLines = Math.max(1, maxLines);
            return this;
        }

        public ToolItem build() {
            return new ToolItem(this);
        }
    }
}

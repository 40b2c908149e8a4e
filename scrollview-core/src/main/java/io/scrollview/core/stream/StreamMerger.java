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

package io.scrollview.core.stream;

import io.scrollview.core.ScrollList;
import io.scrollview.core.items.DividerItem;
import io.scrollview.core.items.HookItem;
import io.scrollview.core.items.InfoItem;
import io.scrollview.core.items.LogItem;
import io.scrollview.core.items.ScrollItem;
import io.scrollview.core.items.SubagentItem;
import io.scrollview.core.items.TextItem;
import io.scrollview.core.items.ThinkingItem;
import io.scrollview.core.items.ToolItem;
import io.scrollview.core.items.ToolStatus;
import io.scrollview.core.items.UserItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Applies {@link StreamEvent}s to a {@link ScrollList} on the UI thread, merging into an
 * existing item when one with the event's identity is present and appending otherwise.
 *
 * <p>In-place mutations go through the item's own setters, which invalidate its render cache,
 * followed by {@link ScrollList#contentChanged()} so the cursor is re-validated and, while
 * auto-scrolling, kept on the bottom.</p>
 *
 * <h2>Tool calls</h2>
 * <p>The first {@link StreamEvent.ToolCallUpdate} for a call id appends a {@link ToolItem}.
 * Later updates change it in place; once the input carries a {@code subagent_type} entry the
 * tool item is swapped for a {@link SubagentItem} at the same position.</p>
 *
 * <h2>Hooks</h2>
 * <p>{@link StreamEvent.HookStarted} appends a running, collapsed {@link HookItem};
 * {@link StreamEvent.HookFinished} with the same id records status, output and run time in
 * place. A completion without a matching start is ignored.</p>
 *
 * <p>Not thread-safe. Feed it from {@link EventChannel#drainTo(Consumer, int)}.</p>
 */
public class StreamMerger implements Consumer<StreamEvent> {

    private static final Logger logger = LogManager.getLogger(StreamMerger.class);

    static final String SUBAGENT_TYPE_KEY = "subagent_type";
    static final String SUBAGENT_PROMPT_KEY = "prompt";

    private final ScrollList list;
    private final int toolMaxLines;

    /**
     * Creates a merger for the given list with the default tool output cap.
     */
    public StreamMerger(ScrollList list) {
        this(list, 10);
    }

    /**
     * @param list the list to merge into
     * @param toolMaxLines output lines a collapsed tool item shows
     */
    public StreamMerger(ScrollList list, int toolMaxLines) {
        this.list = Objects.requireNonNull(list, "list must not be null");
        this.toolMaxLines = toolMaxLines;
    }

    public ScrollList list() {
        return list;
    }

    @Override
    public void accept(StreamEvent event) {
        apply(event);
    }

    /**
     * Applies one event.
     *
     * @param event the event to merge or append
     */
    public void apply(StreamEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (event instanceof StreamEvent.TextDelta delta) {
            applyTextDelta(delta);
        } else if (event instanceof StreamEvent.ThinkingDelta delta) {
            applyThinkingDelta(delta);
        } else if (event instanceof StreamEvent.UserMessage message) {
            applyUserMessage(message);
        } else if (event instanceof StreamEvent.ToolCallUpdate update) {
            applyToolUpdate(update);
        } else if (event instanceof StreamEvent.ToolFailed failed) {
            applyToolStatus(failed.toolCallId(), ToolStatus.ERROR, failed.error());
        } else if (event instanceof StreamEvent.ToolCanceled canceled) {
            applyToolStatus(canceled.toolCallId(), ToolStatus.CANCELED, null);
        } else if (event instanceof StreamEvent.HookStarted started) {
            applyHookStarted(started);
        } else if (event instanceof StreamEvent.HookFinished finished) {
            applyHookFinished(finished);
        } else if (event instanceof StreamEvent.IterationStarted started) {
            list.appendItem(new DividerItem(uniqueId(started.logicalId()), started.iteration()));
        } else if (event instanceof StreamEvent.Finished finished) {
            applyFinished(finished);
        } else if (event instanceof StreamEvent.LogRecord record) {
            list.appendItem(new LogItem(record.id(), record.text()));
        }
    }

    /**
     * Drops every item and resumes following new content.
     */
    public void clear() {
        list.clear();
        list.setAutoScroll(true);
    }

    private void applyTextDelta(StreamEvent.TextDelta delta) {
        int index = list.indexOf(delta.messageId());
        if (index >= 0 && list.itemAt(index) instanceof TextItem text) {
            text.append(delta.text());
            list.contentChanged();
            return;
        }
        list.appendItem(new TextItem(idFor(index, delta.messageId()), delta.text()));
    }

    private void applyThinkingDelta(StreamEvent.ThinkingDelta delta) {
        int index = list.indexOf(delta.messageId());
        if (index >= 0 && list.itemAt(index) instanceof ThinkingItem thinking) {
            thinking.append(delta.text());
            list.contentChanged();
            return;
        }
        list.appendItem(new ThinkingItem(idFor(index, delta.messageId()), delta.text()));
    }

    private void applyUserMessage(StreamEvent.UserMessage message) {
        int index = list.indexOf(message.messageId());
        if (index >= 0 && list.itemAt(index) instanceof UserItem user) {
            user.append(message.text());
            list.contentChanged();
            return;
        }
        list.appendItem(new UserItem(idFor(index, message.messageId()), message.text()));
    }

    private void applyToolUpdate(StreamEvent.ToolCallUpdate update) {
        ToolStatus status = ToolStatus.fromWire(update.status());
        String subagentType = stringInput(update, SUBAGENT_TYPE_KEY);
        int index = list.indexOf(update.toolCallId());

        if (index < 0) {
            if (subagentType != null) {
                list.appendItem(subagentFrom(update, subagentType, status));
            } else {
                list.appendItem(ToolItem.builder(update.toolCallId())
                        .withTitle(update.title())
                        .withKind(update.kind())
                        .withStatus(status)
                        .withInput(update.input())
                        .withOutput(update.output())
                        .withMaxLines(toolMaxLines)
                        .build());
            }
            logger.debug("New tool call {} ({})", update.toolCallId(), update.title());
            return;
        }

        ScrollItem existing = list.itemAt(index);
        if (existing instanceof SubagentItem subagent) {
            subagent.setStatus(status);
            subagent.setSessionId(update.sessionId());
            list.contentChanged();
        } else if (existing instanceof ToolItem tool) {
            if (subagentType != null) {
                logger.debug("Tool call {} became a {} subagent", update.toolCallId(), subagentType);
                list.replaceItem(index, subagentFrom(update, subagentType, status));
                return;
            }
            tool.setStatus(status);
            if (!update.title().isEmpty()) {
                tool.setTitle(update.title());
            }
            if (!update.kind().isEmpty()) {
                tool.setKind(update.kind());
            }
            if (!update.input().isEmpty()) {
                tool.setInput(update.input());
            }
            if (!update.output().isEmpty()) {
                tool.setOutput(update.output());
            }
            list.contentChanged();
        } else {
            logger.warn("Tool update for {} hit a {}, ignoring", update.toolCallId(),
                    existing.getClass().getSimpleName());
        }
    }

    private void applyToolStatus(String toolCallId, ToolStatus status, String output) {
        int index = list.indexOf(toolCallId);
        if (index < 0) {
            logger.debug("Status {} for unknown tool call {}", status, toolCallId);
            return;
        }
        ScrollItem existing = list.itemAt(index);
        if (existing instanceof ToolItem tool) {
            tool.setStatus(status);
            if (output != null && !output.isEmpty()) {
                tool.setOutput(output);
            }
        } else if (existing instanceof SubagentItem subagent) {
            subagent.setStatus(status);
        } else {
            logger.warn("Status {} for {} hit a {}, ignoring", status, toolCallId,
                    existing.getClass().getSimpleName());
            return;
        }
        list.contentChanged();
    }

    private void applyHookStarted(StreamEvent.HookStarted started) {
        int index = list.indexOf(started.hookId());
        if (index >= 0 && list.itemAt(index) instanceof HookItem) {
            logger.debug("Hook {} already started", started.hookId());
            return;
        }
        list.appendItem(new HookItem(idFor(index, started.hookId()), started.hookType(), started.command(),
                toolMaxLines));
    }

    private void applyHookFinished(StreamEvent.HookFinished finished) {
        int index = list.indexOf(finished.hookId());
        if (index < 0 || !(list.itemAt(index) instanceof HookItem hook)) {
            logger.debug("Completion for unknown hook {}", finished.hookId());
            return;
        }
        hook.finish(finished.failed() ? ToolStatus.ERROR : ToolStatus.SUCCESS, finished.output(),
                finished.duration());
        list.contentChanged();
    }

    private void applyFinished(StreamEvent.Finished finished) {
        if (!list.isEmpty() && list.itemAt(list.size() - 1) instanceof ThinkingItem thinking) {
            thinking.finish(finished.duration());
        }
        if (finished.isCancelled()) {
            for (ScrollItem item : list.items()) {
                if (item instanceof ToolItem tool && tool.status().isActive()) {
                    tool.setStatus(ToolStatus.CANCELED);
                }
            }
        }
        list.contentChanged();

        list.appendItem(new InfoItem(uniqueId("info-" + list.size()),
                finished.model(), finished.provider(), finished.duration()));
        if (!finished.error().isEmpty()) {
            list.appendItem(new TextItem(uniqueId("error-" + list.size()), "Error: " + finished.error()));
        } else if (finished.isCancelled()) {
            list.appendItem(new TextItem(uniqueId("canceled-" + list.size()), "Iteration canceled"));
        }
        logger.debug("Turn finished after {} ({})", finished.duration(),
                finished.reason().isEmpty() ? "no reason" : finished.reason());
    }

    private SubagentItem subagentFrom(StreamEvent.ToolCallUpdate update, String subagentType, ToolStatus status) {
        String description = stringInput(update, SUBAGENT_PROMPT_KEY);
        return new SubagentItem(update.toolCallId(), subagentType, description, status, update.sessionId());
    }

    private static String stringInput(StreamEvent.ToolCallUpdate update, String key) {
        Object value = update.input().get(key);
        return value instanceof String s && !s.isEmpty() ? s : null;
    }

    /**
     * Returns {@code id} unless an item of another variant already holds it (index >= 0), in
     * which case a derived id is used so identities stay unique.
     */
    private String idFor(int existingIndex, String id) {
        if (existingIndex < 0) {
            return id;
        }
        logger.warn("Id {} already belongs to a {}, appending under a derived id", id,
                list.itemAt(existingIndex).getClass().getSimpleName());
        return uniqueId(id);
    }

    private String uniqueId(String base) {
        if (list.indexOf(base) < 0) {
            return base;
        }
        int suffix = 1;
        while (list.indexOf(base + "#" + suffix) >= 0) {
            suffix++;
        }
        return base + "#" + suffix;
    }
}

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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of content handed from a producer to the UI thread. Every event names the
 * logical unit it belongs to through {@link #logicalId()}; the {@link StreamMerger} uses it to
 * decide between mutating an existing item and appending a new one.
 *
 * <p>Events carry no rendering state. They are safe to create on any thread and pass through
 * an {@link EventChannel}.</p>
 */
public sealed interface StreamEvent {

    /**
     * Identity of the item this event creates or updates.
     */
    String logicalId();

    /**
     * A chunk of assistant text for the message {@code messageId}.
     */
    record TextDelta(String messageId, String text) implements StreamEvent {
        public TextDelta {
            Objects.requireNonNull(messageId, "messageId must not be null");
            text = Objects.requireNonNullElse(text, "");
        }

        @Override
        public String logicalId() {
            return messageId;
        }
    }

    /**
     * A chunk of reasoning text for the thinking block {@code messageId}.
     */
    record ThinkingDelta(String messageId, String text) implements StreamEvent {
        public ThinkingDelta {
            Objects.requireNonNull(messageId, "messageId must not be null");
            text = Objects.requireNonNullElse(text, "");
        }

        @Override
        public String logicalId() {
            return messageId;
        }
    }

    /**
     * A message typed by the user.
     */
    record UserMessage(String messageId, String text) implements StreamEvent {
        public UserMessage {
            Objects.requireNonNull(messageId, "messageId must not be null");
            text = Objects.requireNonNullElse(text, "");
        }

        @Override
        public String logicalId() {
            return messageId;
        }
    }

    /**
     * Lifecycle update of a tool call. The first update for an id creates the item, later ones
     * update it in place. Empty kind, input and output leave the previous values in place.
     *
     * @param toolCallId identity of the call
     * @param title tool name
     * @param kind tool category such as {@code edit}, {@code execute} or {@code read}
     * @param status wire status, see {@link io.scrollview.core.items.ToolStatus#fromWire(String)}
     * @param input tool parameters; a {@code subagent_type} entry marks a subagent call
     * @param output tool output so far
     * @param sessionId subagent session id, empty until known
     */
    record ToolCallUpdate(String toolCallId, String title, String kind, String status,
                          Map<String, Object> input, String output, String sessionId) implements StreamEvent {
        public ToolCallUpdate {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            title = Objects.requireNonNullElse(title, "");
            kind = Objects.requireNonNullElse(kind, "");
            status = Objects.requireNonNullElse(status, "pending");
            input = input == null || input.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(input));
            output = Objects.requireNonNullElse(output, "");
            sessionId = Objects.requireNonNullElse(sessionId, "");
        }

        @Override
        public String logicalId() {
            return toolCallId;
        }
    }

    /**
     * Marks a tool call as failed with an error message.
     */
    record ToolFailed(String toolCallId, String error) implements StreamEvent {
        public ToolFailed {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            error = Objects.requireNonNullElse(error, "");
        }

        @Override
        public String logicalId() {
            return toolCallId;
        }
    }

    /**
     * Marks a tool call as canceled.
     */
    record ToolCanceled(String toolCallId) implements StreamEvent {
        public ToolCanceled {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
        }

        @Override
        public String logicalId() {
            return toolCallId;
        }
    }

    /**
     * A lifecycle hook command started running.
     *
     * @param hookId identity of this run, later matched by {@link HookFinished}
     * @param hookType lifecycle phase such as {@code session_start} or {@code pre_iteration}
     * @param command the command line
     */
    record HookStarted(String hookId, String hookType, String command) implements StreamEvent {
        public HookStarted {
            Objects.requireNonNull(hookId, "hookId must not be null");
            hookType = Objects.requireNonNullElse(hookType, "");
            command = Objects.requireNonNullElse(command, "");
        }

        @Override
        public String logicalId() {
            return hookId;
        }
    }

    /**
     * A hook command completed.
     */
    record HookFinished(String hookId, boolean failed, String output, Duration duration) implements StreamEvent {
        public HookFinished {
            Objects.requireNonNull(hookId, "hookId must not be null");
            output = Objects.requireNonNullElse(output, "");
            duration = Objects.requireNonNullElse(duration, Duration.ZERO);
        }

        @Override
        public String logicalId() {
            return hookId;
        }
    }

    /**
     * Start of a new agent iteration, drawn as a divider.
     */
    record IterationStarted(int iteration) implements StreamEvent {
        @Override
        public String logicalId() {
            return "divider-" + iteration;
        }
    }

    /**
     * End of an agent turn.
     *
     * @param model model name, may be empty
     * @param provider provider name, may be empty
     * @param duration how long the turn took
     * @param reason finish reason; {@code cancelled} cancels tools still in flight
     * @param error error message, empty on success
     */
    record Finished(String model, String provider, Duration duration, String reason, String error)
            implements StreamEvent {
        public Finished {
            model = Objects.requireNonNullElse(model, "");
            provider = Objects.requireNonNullElse(provider, "");
            duration = Objects.requireNonNullElse(duration, Duration.ZERO);
            reason = Objects.requireNonNullElse(reason, "");
            error = Objects.requireNonNullElse(error, "");
        }

        public boolean isCancelled() {
            return "cancelled".equals(reason) || "canceled".equals(reason);
        }

        @Override
        public String logicalId() {
            return "finish";
        }
    }

    /**
     * One formatted log record for a log viewer.
     */
    record LogRecord(String id, String text) implements StreamEvent {
        public LogRecord {
            Objects.requireNonNull(id, "id must not be null");
            text = Objects.requireNonNullElse(text, "");
        }

        @Override
        public String logicalId() {
            return id;
        }
    }
}

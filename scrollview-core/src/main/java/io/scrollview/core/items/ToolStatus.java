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

import java.util.Locale;

/**
 * Execution status of a tool call as shown by {@link ToolItem} and {@link SubagentItem}.
 */
public enum ToolStatus {
    PENDING("●"),
    RUNNING("●"),
    SUCCESS("✓"),
    ERROR("×"),
    CANCELED("×");

    private final String icon;

    ToolStatus(String icon) {
        this.icon = icon;
    }

    /**
     * Returns the single glyph drawn in front of the tool name.
     */
    public String icon() {
        return icon;
    }

    /**
     * Returns true for the states a tool can still leave on its own.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Maps the status strings used by agent protocols to a status. Accepts {@code pending},
     * {@code in_progress}, {@code completed}, {@code error} and both spellings of
     * {@code canceled}; anything else, including null, maps to {@link #PENDING}.
     *
     * @param wire the status as received from a producer
     * @return the matching status
     */
    public static ToolStatus fromWire(String wire) {
        if (wire == null) {
            return PENDING;
        }
        return switch (wire.trim().toLowerCase(Locale.ROOT)) {
            case "in_progress" -> RUNNING;
            case "completed" -> SUCCESS;
            case "error" -> ERROR;
            case "canceled", "cancelled" -> CANCELED;
            default -> PENDING;
        };
    }
}

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

package io.scrollview.console;

import java.util.Locale;

/**
 * How a program presents its output, deciding whether logging is routed into a
 * {@link ConsoleListPanel} log viewer.
 *
 * <ul>
 *   <li>{@link #INTERACTIVE}: full-screen JLine panel, logging goes to the viewer</li>
 *   <li>{@link #ENHANCED}: ANSI colours on a stream that is not a console</li>
 *   <li>{@link #BASIC}: plain text for dumb terminals and captured output</li>
 *   <li>{@link #AUTO}: resolved with {@link #detect()}</li>
 * </ul>
 *
 * @see LogViewerIntercept
 */
public enum OutputMode {
    INTERACTIVE("interactive", "Full-screen scroll panel with keyboard navigation and log viewer"),
    ENHANCED("enhanced", "ANSI colours without terminal control"),
    BASIC("basic", "Plain text without colours or cursor movement"),
    AUTO("auto", "Detect from the environment");

    private final String name;
    private final String description;

    OutputMode(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parses a mode name, ignoring case and surrounding blanks.
     *
     * @param value the name, e.g. {@code interactive}
     * @return the mode, or {@link #AUTO} for null and unknown names
     */
    public static OutputMode fromString(String value) {
        if (value == null) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OutputMode mode : values()) {
            if (mode.name.equals(normalized)) {
                return mode;
            }
        }
        return AUTO;
    }

    /**
     * Picks a concrete mode for the current process: {@link #BASIC} when {@code TERM} is unset
     * or {@code dumb}, {@link #ENHANCED} when there is no console attached, otherwise
     * {@link #INTERACTIVE}. Never returns {@link #AUTO}.
     */
    public static OutputMode detect() {
        return detect(System.getenv("TERM"), System.console() != null);
    }

    static OutputMode detect(String term, boolean hasConsole) {
        if (term == null || term.isEmpty() || term.equals("dumb")) {
            return BASIC;
        }
        return hasConsole ? INTERACTIVE : ENHANCED;
    }
}

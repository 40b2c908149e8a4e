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

package io.scrollview.core;

import java.util.Objects;

/**
 * A key as forwarded by the owning panel. Named keys use the short names terminal toolkits
 * commonly print ({@code pgup}, {@code pgdown}, {@code home}, {@code end}, {@code up},
 * {@code down}, {@code left}, {@code right}, {@code esc}, {@code enter}); printable keys use
 * the character itself.
 *
 * @param name the key name
 */
public record KeyPress(String name) {

    public static final KeyPress PAGE_UP = new KeyPress("pgup");
    public static final KeyPress PAGE_DOWN = new KeyPress("pgdown");
    public static final KeyPress HOME = new KeyPress("home");
    public static final KeyPress END = new KeyPress("end");
    public static final KeyPress UP = new KeyPress("up");
    public static final KeyPress DOWN = new KeyPress("down");
    public static final KeyPress LEFT = new KeyPress("left");
    public static final KeyPress RIGHT = new KeyPress("right");
    public static final KeyPress ESCAPE = new KeyPress("esc");
    public static final KeyPress ENTER = new KeyPress("enter");

    public KeyPress {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Key press for a printable character.
     */
    public static KeyPress of(char c) {
        return new KeyPress(String.valueOf(c));
    }

    @Override
    public String toString() {
        return name;
    }
}

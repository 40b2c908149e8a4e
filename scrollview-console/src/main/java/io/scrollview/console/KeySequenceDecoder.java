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

import io.scrollview.core.KeyPress;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw terminal input into {@link KeyPress} values.
 *
 * <p>Recognised sequences:
 * <ul>
 *   <li>{@code ESC [ 5 ~} and {@code ESC [ 6 ~}: page up, page down</li>
 *   <li>{@code ESC [ H}, {@code ESC [ 1 ~}, {@code ESC [ 7 ~}, {@code ESC O H}: home</li>
 *   <li>{@code ESC [ F}, {@code ESC [ 4 ~}, {@code ESC [ 8 ~}, {@code ESC O F}: end</li>
 *   <li>{@code ESC [ A..D} and {@code ESC O A..D}: arrows; with the shift modifier
 *       ({@code ESC [ 1 ; 2 A}) up and down page instead</li>
 *   <li>a lone {@code ESC} followed by nothing within the escape timeout: escape</li>
 *   <li>{@code ESC} followed by another character: {@code alt-<char>}</li>
 * </ul>
 * CR and LF map to enter, tab to {@code tab}, DEL and backspace to {@code backspace}, other
 * control characters to {@code ctrl-<letter>}. Everything else is passed through as a
 * printable key.</p>
 */
public final class KeySequenceDecoder {

    static final int EOF = -1;
    static final int TIMEOUT = -2;
    private static final int ESC = 27;

    private final NonBlockingReader reader;
    private final long escapeTimeoutMs;
    private boolean eof;

    public KeySequenceDecoder(NonBlockingReader reader) {
        this(reader, 10);
    }

    /**
     * @param reader terminal input
     * @param escapeTimeoutMs how long to wait for the rest of an escape sequence
     */
    public KeySequenceDecoder(NonBlockingReader reader, long escapeTimeoutMs) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.escapeTimeoutMs = escapeTimeoutMs;
    }

    /**
     * Reads the next key.
     *
     * @param timeoutMs how long to wait for the first character
     * @return the key, or empty when nothing arrived in time, the input ended or the sequence
     *     was not recognised
     * @throws IOException if the terminal cannot be read
     */
    public Optional<KeyPress> next(long timeoutMs) throws IOException {
        if (eof) {
            return Optional.empty();
        }
        int c = reader.read(timeoutMs);
        if (c == EOF) {
            eof = true;
            return Optional.empty();
        }
        if (c == TIMEOUT) {
            return Optional.empty();
        }
        if (c == ESC) {
            return Optional.ofNullable(decodeEscape());
        }
        return Optional.of(decodeSingle(c));
    }

    /**
     * True once the underlying input reported end of stream.
     */
    public boolean isEof() {
        return eof;
    }

    private KeyPress decodeEscape() throws IOException {
        int next = reader.read(escapeTimeoutMs);
        if (next == TIMEOUT || next == EOF) {
            return KeyPress.ESCAPE;
        }
        if (next == '[') {
            return decodeCsi();
        }
        if (next == 'O') {
            return decodeSs3(reader.read(escapeTimeoutMs));
        }
        if (next == ESC) {
            return KeyPress.ESCAPE;
        }
        return new KeyPress("alt-" + (char) next);
    }

    private KeyPress decodeCsi() throws IOException {
        int key = reader.read(escapeTimeoutMs);
        switch (key) {
            case 'A':
                return KeyPress.UP;
            case 'B':
                return KeyPress.DOWN;
            case 'C':
                return KeyPress.RIGHT;
            case 'D':
                return KeyPress.LEFT;
            case 'H':
                return KeyPress.HOME;
            case 'F':
                return KeyPress.END;
            case '1':
            case '4':
            case '5':
            case '6':
            case '7':
            case '8':
                return decodeNumbered(key);
            default:
                return null;
        }
    }

    private KeyPress decodeNumbered(int digit) throws IOException {
        int next = reader.read(escapeTimeoutMs);
        if (next == '~') {
            switch (digit) {
                case '1':
                case '7':
                    return KeyPress.HOME;
                case '4':
                case '8':
                    return KeyPress.END;
                case '5':
                    return KeyPress.PAGE_UP;
                case '6':
                    return KeyPress.PAGE_DOWN;
                default:
                    return null;
            }
        }
        if (next == ';' && digit == '1') {
            int modifier = reader.read(escapeTimeoutMs);
            int direction = reader.read(escapeTimeoutMs);
            if (modifier == '2') {
                // shift+up/down pages
                if (direction == 'A') {
                    return KeyPress.PAGE_UP;
                }
                if (direction == 'B') {
                    return KeyPress.PAGE_DOWN;
                }
            }
            return decodeSs3(direction);
        }
        return null;
    }

    private static KeyPress decodeSs3(int key) {
        switch (key) {
            case 'A':
                return KeyPress.UP;
            case 'B':
                return KeyPress.DOWN;
            case 'C':
                return KeyPress.RIGHT;
            case 'D':
                return KeyPress.LEFT;
            case 'H':
                return KeyPress.HOME;
            case 'F':
                return KeyPress.END;
            default:
                return null;
        }
    }

    private static KeyPress decodeSingle(int c) {
        if (c == '\r' || c == '\n') {
            return KeyPress.ENTER;
        }
        if (c == '\t') {
            return new KeyPress("tab");
        }
        if (c == 127 || c == 8) {
            return new KeyPress("backspace");
        }
        if (c >= 1 && c <= 26) {
            return new KeyPress("ctrl-" + (char) ('a' + c - 1));
        }
        return KeyPress.of((char) c);
    }
}

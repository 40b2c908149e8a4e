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
import org.jline.utils.NonBlocking;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KeySequenceDecoder")
class KeySequenceDecoderTest {

    private static final long TIMEOUT_MS = 500;

    private static KeySequenceDecoder decoderFor(String input) {
        return new KeySequenceDecoder(NonBlocking.nonBlocking("test", new StringReader(input)), TIMEOUT_MS);
    }

    private static List<String> decodeAll(String input) throws IOException {
        KeySequenceDecoder decoder = decoderFor(input);
        List<String> names = new ArrayList<>();
        while (!decoder.isEof()) {
            decoder.next(TIMEOUT_MS).ifPresent(key -> names.add(key.name()));
        }
        return names;
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "'\u001b[5~', pgup",
            "'\u001b[6~', pgdown",
            "'\u001b[H', home",
            "'\u001b[1~', home",
            "'\u001b[7~', home",
            "'\u001bOH', home",
            "'\u001b[F', end",
            "'\u001b[4~', end",
            "'\u001b[8~', end",
            "'\u001bOF', end",
            "'\u001b[A', up",
            "'\u001b[B', down",
            "'\u001b[C', right",
            "'\u001b[D', left",
            "'\u001bOA', up",
            "'\u001b[1;2A', pgup",
            "'\u001b[1;2B', pgdown",
            "'\u001b[1;5C', right"
    })
    @DisplayName("should decode escape sequences")
    void shouldDecodeEscapeSequences(String input, String expected) throws IOException {
        Optional<KeyPress> key = decoderFor(input).next(TIMEOUT_MS);

        assertThat(key).map(KeyPress::name).hasValue(expected);
    }

    @Test
    @DisplayName("should decode a lone escape and alt combinations")
    void shouldDecodeEscapeAndAlt() throws IOException {
        assertThat(decodeAll("\u001b")).containsExactly("esc");
        assertThat(decodeAll("\u001b\u001b")).containsExactly("esc");
        assertThat(decodeAll("\u001bx")).containsExactly("alt-x");
    }

    @Test
    @DisplayName("should decode control and printable characters")
    void shouldDecodeSingleCharacters() throws IOException {
        assertThat(decodeAll("q\r\n\t\u007f\u0003"))
                .containsExactly("q", "enter", "enter", "tab", "backspace", "ctrl-c");
    }

    @Test
    @DisplayName("should decode a stream of mixed keys in order")
    void shouldDecodeMixedStream() throws IOException {
        assertThat(decodeAll("a\u001b[6~\u001b[Ab"))
                .containsExactly("a", "pgdown", "up", "b");
    }

    @Test
    @DisplayName("should skip unknown sequences")
    void shouldSkipUnknownSequences() throws IOException {
        KeySequenceDecoder decoder = decoderFor("\u001b[Z");

        assertThat(decoder.next(TIMEOUT_MS)).isEmpty();
        assertThat(decoder.isEof()).isFalse();
    }

    @Test
    @DisplayName("should report end of input")
    void shouldReportEof() throws IOException {
        KeySequenceDecoder decoder = decoderFor("");

        assertThat(decoder.next(TIMEOUT_MS)).isEmpty();
        assertThat(decoder.isEof()).isTrue();
        assertThat(decoder.next(TIMEOUT_MS)).isEmpty();
    }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutputMode")
class OutputModeTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "interactive, INTERACTIVE",
            "' Enhanced ', ENHANCED",
            "BASIC, BASIC",
            "auto, AUTO",
            "fancy, AUTO"
    })
    @DisplayName("should parse mode names")
    void shouldParse(String value, OutputMode expected) {
        assertThat(OutputMode.fromString(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat null as auto")
    void shouldParseNull() {
        assertThat(OutputMode.fromString(null)).isEqualTo(OutputMode.AUTO);
    }

    @ParameterizedTest(name = "TERM={0}, console={1} -> {2}")
    @CsvSource({
            ", true, BASIC",
            "dumb, true, BASIC",
            "xterm-256color, false, ENHANCED",
            "xterm-256color, true, INTERACTIVE"
    })
    @DisplayName("should detect the mode from the environment")
    void shouldDetect(String term, boolean hasConsole, OutputMode expected) {
        assertThat(OutputMode.detect(term, hasConsole)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should never detect auto")
    void shouldResolveAuto() {
        assertThat(OutputMode.detect()).isNotEqualTo(OutputMode.AUTO);
        assertThat(OutputMode.INTERACTIVE.getName()).isEqualTo("interactive");
        assertThat(OutputMode.BASIC.getDescription()).isNotBlank();
    }
}

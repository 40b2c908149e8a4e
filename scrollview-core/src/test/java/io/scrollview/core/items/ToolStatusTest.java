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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ToolStatus")
class ToolStatusTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "pending, PENDING",
        "in_progress, RUNNING",
        "completed, SUCCESS",
        "error, ERROR",
        "canceled, CANCELED",
        "cancelled, CANCELED",
        "COMPLETED, SUCCESS",
        "something-else, PENDING"
    })
    void shouldMapWireStatus(String wire, ToolStatus expected) {
        assertThat(ToolStatus.fromWire(wire)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should map null to pending")
    void shouldMapNullToPending() {
        assertThat(ToolStatus.fromWire(null)).isEqualTo(ToolStatus.PENDING);
    }

    @ParameterizedTest
    @EnumSource(value = ToolStatus.class, names = {"PENDING", "RUNNING"})
    void activeStatesShowTheDot(ToolStatus status) {
        assertThat(status.isActive()).isTrue();
        assertThat(status.icon()).isEqualTo("●");
    }

    @Test
    @DisplayName("should give terminal states their own icons")
    void shouldUseTerminalIcons() {
        assertThat(ToolStatus.SUCCESS.icon()).isEqualTo("✓");
        assertThat(ToolStatus.ERROR.icon()).isEqualTo("×");
        assertThat(ToolStatus.CANCELED.icon()).isEqualTo("×");
        assertThat(ToolStatus.SUCCESS.isActive()).isFalse();
    }
}

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

import java.time.Duration;

/**
 * Compact duration labels: {@code 345ms}, {@code 1.2s}, {@code 2m30s}, {@code 1h5m0s}.
 * Sub-second values are rounded to milliseconds, sub-minute values to tenths of a second and
 * everything longer to whole seconds.
 */
final class Durations {

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_TENTH = 100_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Durations() {
    }

    static String format(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return "0s";
        }
        long nanos = duration.toNanos();
        if (nanos < NANOS_PER_SECOND) {
            long millis = (nanos + NANOS_PER_MILLI / 2) / NANOS_PER_MILLI;
            if (millis < 1000) {
                return millis + "ms";
            }
        }
        long tenths = (nanos + NANOS_PER_TENTH / 2) / NANOS_PER_TENTH;
        if (tenths < 600) {
            long seconds = tenths / 10;
            long fraction = tenths % 10;
            return fraction == 0 ? seconds + "s" : seconds + "." + fraction + "s";
        }
        long totalSeconds = (nanos + NANOS_PER_SECOND / 2) / NANOS_PER_SECOND;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return hours + "h" + minutes + "m" + seconds + "s";
        }
        return minutes + "m" + seconds + "s";
    }
}

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

import io.scrollview.core.text.TextLayout;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One-line run metadata: {@code ◇ model via provider ⏱ 1.2s}. Model and provider are
 * optional and left out when empty.
 */
public final class InfoItem extends AbstractScrollItem implements ScrollItem {

    private final String model;
    private final String provider;
    private final Duration duration;

    public InfoItem(String id, String model, String provider, Duration duration) {
        super(id);
        this.model = Objects.requireNonNullElse(model, "");
        this.provider = Objects.requireNonNullElse(provider, "");
        this.duration = Objects.requireNonNullElse(duration, Duration.ZERO);
    }

    public String model() {
        return model;
    }

    public String provider() {
        return provider;
    }

    public Duration duration() {
        return duration;
    }

    @Override
    protected List<String> layout(int width) {
        StringBuilder sb = new StringBuilder("◇ ");
        if (!model.isEmpty()) {
            sb.append(model).append(' ');
            if (!provider.isEmpty()) {
                sb.append("via ").append(provider).append(' ');
            }
        }
        sb.append("⏱ ").append(Durations.format(duration));
        return List.of(TextLayout.truncate(sb.toString(), width));
    }
}

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One producer's handle on an {@link EventChannel}. Safe to use from any thread.
 *
 * <p>After {@link #cancel()} the sink rejects every further event. Items that earlier events
 * already created stay in the list as they are.</p>
 */
public final class ProducerSink {

    private static final Logger logger = LogManager.getLogger(ProducerSink.class);

    private final String name;
    private final EventChannel channel;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    ProducerSink(String name, EventChannel channel) {
        this.name = name;
        this.channel = channel;
    }

    /**
     * Offers an event without blocking.
     *
     * @param event the event to queue
     * @return true if the event was queued, false if the sink is cancelled or the channel is
     *     closed or full
     */
    public boolean offer(StreamEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (cancelled.get()) {
            logger.trace("Producer {} is cancelled, rejecting {}", name, event.logicalId());
            return false;
        }
        return channel.offer(event);
    }

    /**
     * Stops accepting events from this producer.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.debug("Producer {} cancelled", name);
        }
    }

    /**
     * True once the sink was cancelled or its channel closed.
     */
    public boolean isCancelled() {
        return cancelled.get() || channel.isClosed();
    }

    public String name() {
        return name;
    }
}

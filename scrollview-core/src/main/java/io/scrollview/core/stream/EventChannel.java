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
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded hand-off queue between producer threads and the UI thread.
 *
 * <p>Producers obtain a {@link ProducerSink} through {@link #openSink(String)} and offer
 * immutable {@link StreamEvent}s from any thread. The UI thread periodically calls
 * {@link #drainTo(Consumer, int)} and applies what it gets, usually through a
 * {@link StreamMerger}. Offers never block: when the queue is full the event is dropped and
 * counted.</p>
 *
 * <p>Closing the channel rejects all further offers. Events already queued can still be
 * drained.</p>
 */
public final class EventChannel implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(EventChannel.class);

    /** Default number of events that can wait for the UI thread. */
    public static final int DEFAULT_CAPACITY = 10_000;

    private final BlockingQueue<StreamEvent> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    public EventChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of queued events, at least 1
     */
    public EventChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Opens a sink for one producer. Cancelling the sink affects that producer only.
     *
     * @param producerName name used in log messages
     * @return a new sink bound to this channel
     */
    public ProducerSink openSink(String producerName) {
        Objects.requireNonNull(producerName, "producerName must not be null");
        logger.debug("Opened sink for producer {}", producerName);
        return new ProducerSink(producerName, this);
    }

    /**
     * Queues an event unless the channel is closed or full.
     */
    boolean offer(StreamEvent event) {
        if (closed.get()) {
            return false;
        }
        if (queue.offer(event)) {
            return true;
        }
        long count = dropped.incrementAndGet();
        if (count == 1 || count % 1000 == 0) {
            logger.warn("Event channel full, dropped {} events so far", count);
        }
        return false;
    }

    /**
     * Hands up to {@code max} queued events, oldest first, to {@code consumer} on the calling
     * thread.
     *
     * @param consumer receiver of the events, typically a {@link StreamMerger}
     * @param max upper bound on events handled by this call
     * @return number of events handed over
     */
    public int drainTo(Consumer<? super StreamEvent> consumer, int max) {
        Objects.requireNonNull(consumer, "consumer must not be null");
        int count = 0;
        while (count < max) {
            StreamEvent event = queue.poll();
            if (event == null) {
                break;
            }
            consumer.accept(event);
            count++;
        }
        return count;
    }

    /**
     * Number of events waiting to be drained.
     */
    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Event channel closed with {} events pending", queue.size());
        }
    }
}

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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Replays a recorded list of events into a sink on a daemon thread, optionally pausing between
 * events. Used to show a finished subagent session the way it originally streamed.
 *
 * <pre>{@code
 * ReplayProducer replay = new ReplayProducer("session-42", events, Duration.ofMillis(20));
 * replay.start(channel.openSink("session-42"));
 * }</pre>
 */
public class ReplayProducer implements ContentProducer {

    private static final Logger logger = LogManager.getLogger(ReplayProducer.class);

    private final String name;
    private final List<StreamEvent> events;
    private final Duration delay;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile ProducerSink sink;
    private volatile Thread worker;
    private volatile int delivered;

    public ReplayProducer(String name, List<? extends StreamEvent> events) {
        this(name, events, Duration.ZERO);
    }

    /**
     * @param name thread and log name
     * @param events events in replay order
     * @param delay pause before each event after the first, zero for none
     */
    public ReplayProducer(String name, List<? extends StreamEvent> events, Duration delay) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.events = List.copyOf(events);
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    @Override
    public synchronized void start(ProducerSink sink) {
        if (worker != null) {
            throw new IllegalStateException("Replay " + name + " already started");
        }
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        Thread thread = new Thread(this::replay, "replay-" + name);
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    private void replay() {
        logger.debug("Replaying {} events for {}", events.size(), name);
        try {
            for (StreamEvent event : events) {
                if (sink.isCancelled()) {
                    logger.debug("Replay {} stopped after {} events", name, delivered);
                    return;
                }
                if (delivered > 0 && !delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
                if (sink.offer(event)) {
                    delivered++;
                }
            }
            logger.debug("Replay {} finished, {} events delivered", name, delivered);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Replay {} interrupted after {} events", name, delivered);
        } finally {
            done.countDown();
        }
    }

    @Override
    public void cancel() {
        ProducerSink current = sink;
        if (current != null) {
            current.cancel();
        }
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Waits for the replay thread to finish.
     *
     * @return true if the replay finished within the timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Number of events the sink accepted so far.
     */
    public int delivered() {
        return delivered;
    }
}

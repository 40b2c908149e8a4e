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

/**
 * An upstream source of {@link StreamEvent}s such as an agent session, a session replay or a
 * log tail. Producers run on their own threads and talk to the UI only through the sink they
 * are started with.
 */
public interface ContentProducer {

    /**
     * Starts producing into {@code sink}. Must return promptly; the work happens on a thread
     * owned by the producer.
     *
     * @param sink where events go
     */
    void start(ProducerSink sink);

    /**
     * Stops producing. Events already delivered stay applied.
     */
    void cancel();
}

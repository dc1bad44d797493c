/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.zenbot.domain.loop;

import me.zenbot.domain.model.Event;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded FIFO between producer threads and the single consumer.
 * {@link #enqueue(Event)} never blocks and is safe from any thread.
 */
public class EventQueue {

    private final Queue<Event> events = new ConcurrentLinkedQueue<>();

    public void enqueue(Event event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    public boolean hasPending() {
        return !events.isEmpty();
    }

    /**
     * @return the oldest event, or {@code null} if the queue is empty
     */
    public Event takeOne() {
        return events.poll();
    }

    public int size() {
        return events.size();
    }
}

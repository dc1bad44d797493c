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

package me.zenbot.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable message delivered to the agent state machine. The payload is
 * opaque: a string for {@link EventType#USER_MESSAGE}, a map of reminder fields
 * for {@link EventType#REMINDER_DUE}, nothing for {@link EventType#TICK}.
 */
public record Event(EventType type, Object payload) {

    private static final Event TICK = new Event(EventType.TICK, null);

    public Event {
        Objects.requireNonNull(type, "type");
    }

    public static Event userMessage(String text) {
        return new Event(EventType.USER_MESSAGE, text);
    }

    public static Event reminderDue(Map<String, Object> reminder) {
        return new Event(EventType.REMINDER_DUE, reminder == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(reminder)));
    }

    public static Event tick() {
        return TICK;
    }

    public boolean isTick() {
        return type == EventType.TICK;
    }
}

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted reminder. {@code when} keeps the offset the user set it in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reminder {

    private String id;
    private Instant createdAt;
    private String task;
    private OffsetDateTime when;
    private String notes;
    private boolean completed;

    /**
     * Payload carried by a {@link EventType#REMINDER_DUE} event.
     */
    public Map<String, Object> toDuePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("task", task);
        payload.put("when", when != null ? when.toString() : null);
        payload.put("notes", notes);
        return payload;
    }
}

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

package me.zenbot.adapter.outbound.storage;

import me.zenbot.domain.model.Reminder;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.ReminderStorePort;
import me.zenbot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reminder store backed by a single JSON file in the workspace.
 *
 * <p>
 * Every operation reads the file fresh and writes it back atomically, so no
 * state is held between calls. All operations synchronize on this instance,
 * which serializes writes from the poller thread and the consumer thread.
 */
@Component
@Slf4j
public class JsonReminderStoreAdapter implements ReminderStorePort {

    private static final TypeReference<List<Reminder>> REMINDER_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;
    private final String fileName;

    public JsonReminderStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getReminders().getDirectory();
        this.fileName = properties.getReminders().getFile();
    }

    @Override
    public synchronized Reminder add(String task, OffsetDateTime when, String notes) {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Reminder task must not be blank");
        }
        if (when == null) {
            throw new IllegalArgumentException("Reminder time must be set");
        }
        Reminder reminder = Reminder.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .task(task.strip())
                .when(when)
                .notes(notes)
                .completed(false)
                .build();
        List<Reminder> reminders = load();
        reminders.add(reminder);
        save(reminders);
        log.info("[Reminders] Added reminder {} due {}", reminder.getId(), when);
        return reminder;
    }

    @Override
    public synchronized Optional<Reminder> getById(String id) {
        return load().stream()
                .filter(r -> r.getId().equals(id))
                .findFirst();
    }

    @Override
    public synchronized List<Reminder> listActive(boolean includeCompleted) {
        List<Reminder> result = new ArrayList<>();
        for (Reminder reminder : load()) {
            if (includeCompleted || !reminder.isCompleted()) {
                result.add(reminder);
            }
        }
        result.sort(Comparator.comparing(Reminder::getCreatedAt,
                Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed());
        return result;
    }

    @Override
    public synchronized boolean markCompleted(String id) {
        List<Reminder> reminders = load();
        for (Reminder reminder : reminders) {
            if (reminder.getId().equals(id)) {
                reminder.setCompleted(true);
                save(reminders);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized boolean delete(String id) {
        List<Reminder> reminders = load();
        Iterator<Reminder> iterator = reminders.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getId().equals(id)) {
                iterator.remove();
                save(reminders);
                log.info("[Reminders] Deleted reminder {}", id);
                return true;
            }
        }
        return false;
    }

    private List<Reminder> load() {
        String json = storagePort.getText(directory, fileName).join();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, REMINDER_LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt reminder file: " + directory + "/" + fileName, e);
        }
    }

    private void save(List<Reminder> reminders) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(reminders);
            storagePort.putTextAtomic(directory, fileName, json, true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reminders", e);
        }
    }
}

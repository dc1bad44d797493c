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

package me.zenbot.port.outbound;

import me.zenbot.domain.model.Reminder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistent reminder store. Used concurrently by the reminder poller and by
 * tools on the consumer thread; implementations serialize their own writes.
 */
public interface ReminderStorePort {

    /**
     * Stores a new reminder.
     *
     * @throws IllegalArgumentException
     *             if task is blank or when is missing
     */
    Reminder add(String task, OffsetDateTime when, String notes);

    Optional<Reminder> getById(String id);

    /**
     * Lists reminders, newest first.
     *
     * @param includeCompleted
     *            whether completed reminders are included
     */
    List<Reminder> listActive(boolean includeCompleted);

    /**
     * @return true if a reminder with this id existed and was updated
     */
    boolean markCompleted(String id);

    /**
     * @return true if a reminder with this id existed and was removed
     */
    boolean delete(String id);
}

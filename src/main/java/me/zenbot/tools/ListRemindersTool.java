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

package me.zenbot.tools;

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.model.Reminder;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.model.ToolResults;
import me.zenbot.domain.service.ReminderTimeService;
import me.zenbot.port.outbound.ReminderStorePort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists active reminders with a ready-made summary for the user.
 */
@Component
@RequiredArgsConstructor
public class ListRemindersTool implements ToolComponent {

    static final String NO_REMINDERS_MESSAGE = "You don't have any active reminders.";

    private final ReminderStorePort reminderStore;
    private final ReminderTimeService timeService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("list_reminders",
                "List all active reminders. Use when the user asks what reminders they have.");
    }

    @Override
    public String getUserMessage() {
        return "Fetching your reminders...";
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        List<Reminder> reminders = reminderStore.listActive(false);

        Map<String, Object> result = ToolResults.success();
        if (reminders.isEmpty()) {
            result.put("count", 0);
            result.put("message", NO_REMINDERS_MESSAGE);
            result.put("reminders", List.of());
            return result;
        }

        List<Map<String, Object>> entries = new ArrayList<>();
        StringBuilder summary = new StringBuilder()
                .append("You have ").append(reminders.size()).append(" reminder(s):\n");
        int number = 1;
        for (Reminder reminder : reminders) {
            String whenHuman = timeService.formatWhen(reminder.getWhen());

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("number", number);
            entry.put("task", reminder.getTask());
            entry.put("when", reminder.getWhen().toString());
            entry.put("when_human", whenHuman);
            entry.put("id", reminder.getId());
            entry.put("created_at", reminder.getCreatedAt() != null ? reminder.getCreatedAt().toString() : null);
            entry.put("notes", reminder.getNotes());
            entries.add(entry);

            summary.append('\n').append(number).append(". **").append(reminder.getTask()).append("** – ")
                    .append(whenHuman);
            number++;
        }

        result.put("count", reminders.size());
        result.put("reminders", entries);
        result.put("summary", summary.toString());
        return result;
    }
}

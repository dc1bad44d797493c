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
import me.zenbot.domain.service.StructuredOutputService;
import me.zenbot.port.outbound.ReminderStorePort;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deletes the reminder the user describes. The model picks the matching id
 * from the active list; past reminders are purged afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeleteReminderTool implements ToolComponent {

    static final String MATCHING_PROMPT = "You match a user's deletion request to a specific reminder. "
            + "Analyze the user's request and the list of available reminders, "
            + "then return the exact ID of the reminder they want to delete. "
            + "Return ONLY a JSON object with the keys \"reminder_id\", \"confidence\" "
            + "('high', 'medium' or 'low') and optional \"reason\".";

    static final String CONFIRMATION_PROMPT = "Generate a short confirmation message for a deleted reminder. "
            + "Return ONLY a JSON object with the key \"confirmation_message\".";

    private final ReminderStorePort reminderStore;
    private final StructuredOutputService structuredOutput;
    private final ReminderTimeService timeService;

    /**
     * The model's pick among the active reminders.
     */
    public record ReminderMatch(
            @JsonProperty("reminder_id") String reminderId,
            @JsonProperty("confidence") String confidence,
            @JsonProperty("reason") String reason) implements StructuredOutputService.Validated {

        @Override
        public boolean isValid() {
            return reminderId != null && !reminderId.isBlank();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("delete_reminder")
                .description("Delete, remove or cancel one of the user's reminders. "
                        + "Examples: 'Delete my water reminder', 'Cancel reminder number 2'")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "request", Map.of(
                                        "type", "string",
                                        "minLength", 1,
                                        "description",
                                        "The user's deletion request describing which reminder to delete. "
                                                + "Can reference the task, time, or position in the list.")),
                        "required", List.of("request")))
                .build();
    }

    @Override
    public String getUserMessage() {
        return "Deleting your reminder...";
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        String userRequest = (String) arguments.get("request");

        List<Reminder> reminders = reminderStore.listActive(false);
        if (reminders.isEmpty()) {
            log.debug("[Reminders] delete_reminder: no active reminders");
            return ToolResults.failure("You don't have any active reminders to delete.");
        }

        Optional<ReminderMatch> match = structuredOutput.extract(
                MATCHING_PROMPT, describe(reminders) + "\nUser request: " + userRequest, ReminderMatch.class);
        if (match.isEmpty()) {
            log.warn("[Reminders] delete_reminder match failed");
            return ToolResults.failure("Could not identify which reminder you want to delete. "
                    + "Please be more specific.");
        }

        String reminderId = match.get().reminderId().strip();
        Optional<Reminder> found = reminderStore.getById(reminderId);
        if (found.isEmpty()) {
            log.warn("[Reminders] delete_reminder matched missing id {}", reminderId);
            return ToolResults.failure("The matched reminder could not be found in the database.");
        }
        Reminder reminder = found.get();

        try {
            if (!reminderStore.delete(reminderId)) {
                log.warn("[Reminders] delete_reminder: store reported nothing deleted for {}", reminderId);
                return ToolResults.failure("Failed to delete the reminder from the database.");
            }
        } catch (RuntimeException e) {
            log.error("[Reminders] delete_reminder failed", e);
            return ToolResults.failure("Could not delete reminder due to error: " + e.getMessage());
        }

        purgePastReminders();

        String when = reminder.getWhen() != null ? reminder.getWhen().toString() : "";
        String confirmation = structuredOutput.extract(CONFIRMATION_PROMPT,
                "Deleted reminder - Task: " + reminder.getTask() + ", When: " + when,
                SetReminderTool.ReminderConfirmation.class)
                .map(c -> c.confirmationMessage().strip())
                .orElseGet(() -> "Reminder deleted: " + reminder.getTask() + " (" + when + ").");

        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("task", reminder.getTask());
        deleted.put("when", when);
        deleted.put("id", reminder.getId());

        Map<String, Object> result = ToolResults.success();
        result.put("confirmation", confirmation);
        result.put("deleted_reminder", deleted);
        return result;
    }

    private static String describe(List<Reminder> reminders) {
        StringBuilder context = new StringBuilder("Available reminders:\n");
        int index = 1;
        for (Reminder reminder : reminders) {
            context.append(index++).append(". ID: ").append(reminder.getId())
                    .append(", Task: ").append(reminder.getTask())
                    .append(", When: ").append(reminder.getWhen());
            if (reminder.getNotes() != null && !reminder.getNotes().isBlank()) {
                context.append(", Notes: ").append(reminder.getNotes());
            }
            context.append('\n');
        }
        return context.toString();
    }

    private void purgePastReminders() {
        try {
            int purged = 0;
            for (Reminder reminder : reminderStore.listActive(false)) {
                if (timeService.isPast(reminder.getWhen()) && reminderStore.delete(reminder.getId())) {
                    purged++;
                }
            }
            if (purged > 0) {
                log.info("[Reminders] Purged {} past reminder(s)", purged);
            }
        } catch (RuntimeException e) {
            // housekeeping only, the requested deletion already succeeded
            log.warn("[Reminders] Purging past reminders failed: {}", e.getMessage());
        }
    }
}

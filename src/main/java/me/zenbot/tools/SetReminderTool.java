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

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates a reminder from a natural-language request.
 *
 * <p>
 * The model extracts task, time and date expression exactly as the user said
 * them; parsing and date arithmetic are deterministic
 * ({@link ReminderTimeService}). The confirmation is written by the model
 * with a fixed-format fallback, and is shown to the user directly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SetReminderTool implements ToolComponent {

    static final String EXTRACTION_PROMPT = "You extract reminder request data. "
            + "Return ONLY a JSON object with the keys \"task\", \"time\", \"intended_date\" and \"notes\". "
            + "Do not include markdown, explanations, or extra keys. "
            + "Extract the task, time, and intended_date exactly as the user specified. "
            + "Do NOT perform any date calculations or conversions. "
            + "Do NOT convert time to 24-hour format. "
            + "If the user does NOT explicitly mention a date or day (like 'tomorrow' or 'friday'), "
            + "set intended_date to 'today'. Do not guess. "
            + "intended_date must be 'today', 'tomorrow' or a weekday name. "
            + "notes is optional extra text relevant to the reminder, or null.";

    static final String CONFIRMATION_PROMPT = "You write one short, friendly confirmation for a reminder "
            + "that was just set. Use the provided task, date, and time exactly as given. "
            + "Do not change or infer a different date or time. "
            + "If you mention relative timing (today/tomorrow), it must match the provided current date/time. "
            + "Return ONLY a JSON object with the key \"confirmation_message\".";

    private final ReminderStorePort reminderStore;
    private final StructuredOutputService structuredOutput;
    private final ReminderTimeService timeService;

    /**
     * Fields the model extracts from the request.
     */
    public record ReminderRequest(
            @JsonProperty("task") String task,
            @JsonProperty("time") String time,
            @JsonProperty("intended_date") String intendedDate,
            @JsonProperty("notes") String notes) implements StructuredOutputService.Validated {

        @Override
        public boolean isValid() {
            return task != null && !task.isBlank()
                    && time != null && !time.isBlank()
                    && intendedDate != null && !intendedDate.isBlank();
        }
    }

    /**
     * Confirmation text written by the model.
     */
    public record ReminderConfirmation(
            @JsonProperty("confirmation_message") String confirmationMessage)
            implements StructuredOutputService.Validated {

        @Override
        public boolean isValid() {
            return confirmationMessage != null && !confirmationMessage.isBlank();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("set_reminder")
                .description("Set or create a reminder for a task when the user asks for one. "
                        + "Examples: 'Remind me to drink water at 14:45', "
                        + "'Remind me to do my homework tomorrow at 19:15'")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "request", Map.of(
                                        "type", "string",
                                        "minLength", 1,
                                        "description",
                                        "The user's reminder request preserved exactly as stated, "
                                                + "including both the task and the timing.")),
                        "required", List.of("request")))
                .build();
    }

    @Override
    public String getUserMessage() {
        return "Setting your reminder...";
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        String userRequest = (String) arguments.get("request");

        Optional<ReminderRequest> extracted = structuredOutput.extract(
                EXTRACTION_PROMPT, userRequest, ReminderRequest.class);
        if (extracted.isEmpty()) {
            log.warn("[Reminders] set_reminder extraction failed");
            return ToolResults.failure("Could not extract reminder details. Please specify: what to remind "
                    + "you about, what time, and when (today, tomorrow, or a weekday).");
        }
        ReminderRequest details = extracted.get();

        Optional<LocalTime> time = timeService.parseTime(details.time());
        if (time.isEmpty()) {
            log.warn("[Reminders] set_reminder could not parse time: {}", details.time());
            return ToolResults.failure("Could not parse time '" + details.time()
                    + "'. Please use a format like '9:15', '9:15 AM', or '14:30'.");
        }

        Optional<LocalDate> date = timeService.resolveDate(details.intendedDate());
        if (date.isEmpty()) {
            log.warn("[Reminders] set_reminder could not resolve date: {}", details.intendedDate());
            return ToolResults.failure("Could not interpret date '" + details.intendedDate()
                    + "'. Use 'today', 'tomorrow', or a weekday name.");
        }

        OffsetDateTime when = timeService.combine(date.get(), time.get());
        String notes = details.notes() != null && !details.notes().isBlank() ? details.notes().strip() : null;

        Reminder reminder;
        try {
            reminder = reminderStore.add(details.task().strip(), when, notes);
        } catch (RuntimeException e) {
            log.error("[Reminders] set_reminder failed to save", e);
            return ToolResults.failure("Could not save reminder due to storage error: " + e.getMessage());
        }

        String confirmation = buildConfirmation(reminder.getTask(), date.get(), time.get());

        Map<String, Object> result = ToolResults.success();
        result.put("confirmation", confirmation);
        result.put("reminder_id", reminder.getId());
        result.put("task", reminder.getTask());
        result.put("when", when.toString());
        return result;
    }

    private String buildConfirmation(String task, LocalDate date, LocalTime time) {
        String formattedDate = timeService.formatDate(date);
        String formattedTime = timeService.formatTime(time);
        String details = "Current local date/time: " + timeService.currentLocalContext()
                + "\nTask: " + task
                + "\nDate: " + formattedDate
                + "\nTime: " + formattedTime;

        return structuredOutput.extract(CONFIRMATION_PROMPT, details, ReminderConfirmation.class)
                .map(c -> c.confirmationMessage().strip())
                .orElseGet(() -> {
                    log.debug("[Reminders] set_reminder using fallback confirmation");
                    return "Reminder set: " + task + " on " + formattedDate + " at " + formattedTime + ".";
                });
    }
}

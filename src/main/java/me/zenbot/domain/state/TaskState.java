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

package me.zenbot.domain.state;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.Turn;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Handles background work. For a due reminder it asks the model for a short
 * notification and shows it; the reminder was already marked completed by
 * the poller.
 */
@Slf4j
public final class TaskState implements AgentState {

    public static final TaskState INSTANCE = new TaskState();

    public static final String FALLBACK_REMINDER_MESSAGE = "Hey, just a reminder: it's time now.";

    private static final DateTimeFormatter LOCAL_CONTEXT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final String SYSTEM_PROMPT = "Write one short, friendly reminder notification for the user. "
            + "The reminder is due now, so tell them it is time to do the task now. "
            + "Focus only on this task and optional notes. "
            + "Do not mention other reminders, future timing, or scheduling actions. "
            + "The reminder will be deleted after this notification, so do not include instructions "
            + "about snoozing or rescheduling. Return plain text only.";

    private TaskState() {
    }

    @Override
    public String getName() {
        return "TASK";
    }

    @Override
    public AgentState handle(Agent agent, Event event) {
        if (!event.isTick()) {
            return this;
        }
        Map<String, Object> payload = agent.getTurn().getReminderPayload();
        if (payload != null) {
            notifyDueReminder(agent, payload);
        }
        return CleanupState.INSTANCE;
    }

    private void notifyDueReminder(Agent agent, Map<String, Object> payload) {
        String task = text(payload.get("task"));
        if (task.isEmpty()) {
            task = "your reminder";
        }
        String when = text(payload.get("when"));
        String notes = text(payload.get("notes"));

        StringBuilder userPrompt = new StringBuilder()
                .append("Current local date/time: ")
                .append(ZonedDateTime.now(agent.getClock()).format(LOCAL_CONTEXT))
                .append("\nTask: ").append(task)
                .append("\nDue at: ").append(when.isEmpty() ? "now" : when);
        if (!notes.isEmpty()) {
            userPrompt.append("\nNotes: ").append(notes);
        }

        LlmRequest request = LlmRequest.builder()
                .model(agent.getLlmSettings().getModel())
                .messages(List.of(Message.system(SYSTEM_PROMPT), Message.user(userPrompt.toString())))
                .think(agent.getLlmSettings().isThink())
                .build();

        String message;
        try {
            LlmResponse response = agent.getLlmPort().chat(request).join();
            message = response != null ? text(response.getContent()) : "";
        } catch (Exception e) { // NOSONAR - fall back to a fixed notification
            log.error("[Task] Failed to compose reminder notification", e);
            message = "";
        }
        if (message.isEmpty()) {
            message = FALLBACK_REMINDER_MESSAGE;
        }

        Turn turn = agent.getTurn();
        turn.setAssistantText(message);
        turn.setAssistantStreamed(false);
        agent.getOutput().emitText(message);
        log.debug("[Task] Notified reminder: {}", task);
    }

    private static String text(Object value) {
        return value != null ? value.toString().strip() : "";
    }
}

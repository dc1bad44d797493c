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

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.ToolExecution;
import me.zenbot.domain.model.ToolResults;
import me.zenbot.domain.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs queued tool calls, one per tick.
 *
 * <p>
 * Each result is appended to the working messages as a {@code tool} message.
 * When the last queued call belongs to a tool that writes its own final
 * reply ({@code confirmation} or {@code summary}) and succeeded, that text is
 * emitted directly and the turn ends without another model call. Otherwise
 * control returns to {@link GenerateState} once the queue is empty.
 */
@Slf4j
public final class UseToolsState implements AgentState {

    public static final UseToolsState INSTANCE = new UseToolsState();

    static final String LIST_REMINDERS = "list_reminders";

    /**
     * Tool name to the result field that holds its user-facing reply.
     */
    static final Map<String, String> DIRECT_RESPONSE_FIELDS = Map.of(
            "set_reminder", "confirmation",
            "delete_reminder", "confirmation",
            LIST_REMINDERS, "summary");

    private UseToolsState() {
    }

    @Override
    public String getName() {
        return "USE_TOOLS";
    }

    @Override
    public AgentState handle(Agent agent, Event event) {
        if (!event.isTick()) {
            return this;
        }

        Turn turn = agent.getTurn();
        Message.ToolCall call = turn.getPendingToolCalls().poll();
        if (call == null) {
            return GenerateState.INSTANCE;
        }

        String name = call.getName();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        ToolComponent tool = agent.getToolbox().getTool(name);
        if (tool != null && tool.getUserMessage() != null && !tool.getUserMessage().isBlank()) {
            agent.getOutput().emitStatus(tool.getUserMessage());
        }

        log.debug("[UseTools] Running {} with {}", name, arguments);
        Map<String, Object> result = agent.getToolbox().runTool(name, arguments);
        turn.getToolResults().add(new ToolExecution(name, arguments, result));
        turn.getWorkingMessages().add(Message.tool(call.getId(), name, toJson(agent, viewForModel(name, result))));

        String directResponse = directResponse(name, result);
        if (turn.getPendingToolCalls().isEmpty() && directResponse != null) {
            turn.setAssistantText(directResponse);
            turn.setAssistantStreamed(false);
            agent.getOutput().emitText(directResponse);
            return CleanupState.INSTANCE;
        }

        if (!turn.getPendingToolCalls().isEmpty()) {
            return this;
        }
        return GenerateState.INSTANCE;
    }

    /**
     * Reminder listings reach the model as count and summary only, so it
     * cannot answer from individual entries it saw in earlier turns.
     */
    static Map<String, Object> viewForModel(String name, Map<String, Object> result) {
        if (LIST_REMINDERS.equals(name) && result.get("summary") != null) {
            Map<String, Object> reduced = new LinkedHashMap<>();
            reduced.put("success", result.get("success"));
            reduced.put("count", result.get("count"));
            reduced.put("summary", result.get("summary"));
            return reduced;
        }
        return result;
    }

    static String directResponse(String name, Map<String, Object> result) {
        String field = DIRECT_RESPONSE_FIELDS.get(name);
        if (field == null || ToolResults.isFailure(result)) {
            return null;
        }
        Object value = result.get(field);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    private static String toJson(Agent agent, Map<String, Object> value) {
        try {
            return agent.getObjectMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[UseTools] Failed to serialize tool result: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}

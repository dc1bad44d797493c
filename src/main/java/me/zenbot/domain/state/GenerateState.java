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
import me.zenbot.domain.model.LlmChunk;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.LlmToolCall;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.Turn;
import me.zenbot.port.outbound.OutputPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Calls the model with the turn's working messages and the tool schema.
 *
 * <p>
 * A reply with tool calls queues them and moves to {@link UseToolsState}; a
 * plain reply becomes the assistant text and moves to {@link CleanupState}.
 * Backend failures are answered with a fixed apology. Streamed text is shown
 * as it arrives and is not emitted a second time.
 */
@Slf4j
public final class GenerateState implements AgentState {

    public static final GenerateState INSTANCE = new GenerateState();

    public static final String BACKEND_ERROR_MESSAGE = "Sorry, I hit an internal error while generating a response.";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private GenerateState() {
    }

    @Override
    public String getName() {
        return "GENERATE";
    }

    @Override
    public AgentState handle(Agent agent, Event event) {
        if (!event.isTick()) {
            return this;
        }

        Turn turn = agent.getTurn();
        if (turn.getWorkingMessages().isEmpty()) {
            turn.getWorkingMessages().addAll(agent.getHistory().getMessages());
            String userText = turn.getUserText();
            if (userText != null && !userText.isBlank()) {
                turn.getWorkingMessages().add(Message.user(userText));
            }
        }

        boolean stream = agent.getLlmSettings().isStream() && agent.getLlmPort().supportsStreaming();

        LlmRequest request = LlmRequest.builder()
                .model(agent.getLlmSettings().getModel())
                .messages(new ArrayList<>(turn.getWorkingMessages()))
                .tools(agent.getToolbox().getDefinitions())
                .stream(stream)
                .think(agent.getLlmSettings().isThink())
                .build();

        LlmResponse response;
        try {
            response = request.isStream()
                    ? collectStream(agent, request)
                    : agent.getLlmPort().chat(request).join();
        } catch (Exception e) { // NOSONAR - backend failures end the turn with an apology
            log.error("[Generate] Model call failed", e);
            turn.setAssistantText(BACKEND_ERROR_MESSAGE);
            turn.setAssistantStreamed(false);
            agent.getOutput().emitText(BACKEND_ERROR_MESSAGE);
            return CleanupState.INSTANCE;
        }

        if (response != null && response.hasToolCalls()) {
            List<Message.ToolCall> calls = parseToolCalls(response.getToolCalls(), agent.getObjectMapper());
            if (!calls.isEmpty()) {
                turn.setAssistantStreamed(false);
                turn.getWorkingMessages().add(Message.builder()
                        .role(Message.ROLE_ASSISTANT)
                        .content(response.getContent() != null ? response.getContent() : "")
                        .toolCalls(calls)
                        .build());
                turn.getPendingToolCalls().addAll(calls);
                log.debug("[Generate] Queued {} tool call(s)", calls.size());
                return UseToolsState.INSTANCE;
            }
            log.warn("[Generate] Reply carried only unusable tool calls, treating it as text");
        }

        String text = response != null && response.getContent() != null ? response.getContent() : "";
        boolean streamed = request.isStream() && !text.isEmpty();
        turn.setAssistantText(text);
        turn.setAssistantStreamed(streamed);
        if (!streamed && !text.isEmpty()) {
            agent.getOutput().emitText(text);
        }
        return CleanupState.INSTANCE;
    }

    private LlmResponse collectStream(Agent agent, LlmRequest request) {
        OutputPort output = agent.getOutput();
        StringBuilder content = new StringBuilder();
        List<LlmToolCall> toolCalls = new ArrayList<>();
        boolean streamOpen = false;
        try {
            for (LlmChunk chunk : agent.getLlmPort().chatStream(request).toIterable()) {
                if (chunk.hasText()) {
                    if (!streamOpen) {
                        output.beginStream();
                        streamOpen = true;
                    }
                    output.emitStreamChunk(chunk.getText());
                    content.append(chunk.getText());
                }
                if (chunk.hasToolCalls()) {
                    toolCalls.addAll(chunk.getToolCalls());
                }
            }
        } finally {
            if (streamOpen) {
                output.endStream();
            }
        }
        return LlmResponse.builder()
                .content(content.toString())
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .build();
    }

    private List<Message.ToolCall> parseToolCalls(List<LlmToolCall> rawCalls, ObjectMapper objectMapper) {
        List<Message.ToolCall> calls = new ArrayList<>();
        for (LlmToolCall raw : rawCalls) {
            String name = raw.getName() != null ? raw.getName().strip() : "";
            if (name.isEmpty()) {
                log.warn("[Generate] Skipping tool call without a name");
                continue;
            }
            String id = raw.getId() != null && !raw.getId().isBlank()
                    ? raw.getId()
                    : "call_" + UUID.randomUUID().toString().substring(0, 8);
            calls.add(Message.ToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(parseArguments(raw.getArguments(), objectMapper))
                    .build());
        }
        return calls;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> parseArguments(Object raw, ObjectMapper objectMapper) {
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        if (raw instanceof String) {
            String json = ((String) raw).strip();
            if (json.isEmpty()) {
                return Collections.emptyMap();
            }
            try {
                Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE_REF);
                return parsed != null ? parsed : Collections.emptyMap();
            } catch (Exception e) {
                log.warn("[Generate] Failed to parse tool arguments: {}", e.getMessage());
                return Collections.emptyMap();
            }
        }
        return Collections.emptyMap();
    }
}

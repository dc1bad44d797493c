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

package me.zenbot.domain.service;

import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.Message;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Asks the model for a single JSON object and maps it onto a Java type.
 *
 * <p>
 * Used by tools for extraction and for short confirmation texts. Backend
 * errors, malformed JSON and rejected values all yield an empty result so the
 * caller can fall back to deterministic text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredOutputService {

    /**
     * Implemented by extraction types that carry constraints beyond JSON shape.
     */
    public interface Validated {
        boolean isValid();
    }

    private final LlmPort llmPort;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    public <T> Optional<T> extract(String systemPrompt, String userPrompt, Class<T> type) {
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .messages(List.of(Message.system(systemPrompt), Message.user(userPrompt)))
                .think(properties.getLlm().isThink())
                .jsonResponse(true)
                .build();
        try {
            LlmResponse response = llmPort.chat(request).join();
            String content = response != null ? response.getContent() : null;
            if (content == null || content.isBlank()) {
                log.debug("[Structured] Empty reply for {}", type.getSimpleName());
                return Optional.empty();
            }
            T value = objectMapper.readValue(stripCodeFence(content), type);
            if (value instanceof Validated && !((Validated) value).isValid()) {
                log.debug("[Structured] Rejected {}: {}", type.getSimpleName(), value);
                return Optional.empty();
            }
            return Optional.ofNullable(value);
        } catch (Exception e) { // NOSONAR - any failure falls back to the caller's default
            log.warn("[Structured] Extraction of {} failed: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String stripCodeFence(String content) {
        String text = content.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return text.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return text;
    }
}

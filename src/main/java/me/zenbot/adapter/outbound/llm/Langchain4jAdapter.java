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

package me.zenbot.adapter.outbound.llm;

import me.zenbot.domain.model.LlmChunk;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.LlmToolCall;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.infrastructure.config.BotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Serves two providers:
 * <ul>
 * <li>{@code ollama} - a local or remote Ollama server (default
 * {@code http://localhost:11434})
 * <li>{@code openai} - OpenAI or any OpenAI-compatible endpoint
 * </ul>
 *
 * <p>
 * Features:
 * <ul>
 * <li>Function calling (tool use) with tool schemas converted from
 * {@link ToolDefinition}
 * <li>Token streaming through {@link StreamingChatResponseHandler}
 * <li>JSON-object replies for structured extraction
 * <li>Retry with exponential backoff for rate limits
 * </ul>
 *
 * <p>
 * Tool-call arguments are passed on as the raw JSON string the provider
 * returned; parsing happens in the domain.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_OLLAMA = "ollama";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private StreamingChatModel streamingModel;
    private volatile boolean initialized = false;
    private volatile boolean thinkWarned = false;

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public boolean supportsProvider(String provider) {
        return PROVIDER_OLLAMA.equals(provider) || PROVIDER_OPENAI.equals(provider);
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        BotProperties.LlmProperties llm = properties.getLlm();
        Duration timeout = Duration.ofMillis(llm.getTimeoutMs());
        if (PROVIDER_OPENAI.equals(llm.getProvider())) {
            this.chatModel = createOpenAiModel(llm, timeout);
            this.streamingModel = createOpenAiStreamingModel(llm, timeout);
        } else {
            this.chatModel = createOllamaModel(llm, timeout);
            this.streamingModel = createOllamaStreamingModel(llm, timeout);
        }
        initialized = true;
        log.info("[LLM] Initialized {} model {}", llm.getProvider(), llm.getModel());
    }

    private ChatModel createOllamaModel(BotProperties.LlmProperties llm, Duration timeout) {
        var builder = OllamaChatModel.builder()
                .baseUrl(ollamaBaseUrl(llm))
                .modelName(llm.getModel())
                .timeout(timeout);
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private StreamingChatModel createOllamaStreamingModel(BotProperties.LlmProperties llm, Duration timeout) {
        var builder = OllamaStreamingChatModel.builder()
                .baseUrl(ollamaBaseUrl(llm))
                .modelName(llm.getModel())
                .timeout(timeout);
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(BotProperties.LlmProperties llm, Duration timeout) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(timeout);
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiStreamingModel(BotProperties.LlmProperties llm, Duration timeout) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .timeout(timeout);
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private static String ollamaBaseUrl(BotProperties.LlmProperties llm) {
        return llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank() ? llm.getBaseUrl() : DEFAULT_OLLAMA_URL;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatRequest chatRequest = buildChatRequest(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(chatRequest));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            ensureInitialized();
            ChatRequest chatRequest = buildChatRequest(request);
            streamingModel.chat(chatRequest, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    sink.next(LlmChunk.text(partialResponse));
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    LlmResponse response = convertResponse(completeResponse);
                    sink.next(LlmChunk.builder()
                            .toolCalls(response.getToolCalls())
                            .done(true)
                            .build());
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    log.error("[LLM] Streaming chat failed", error);
                    sink.error(error);
                }
            });
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        BotProperties.LlmProperties llm = properties.getLlm();
        if (PROVIDER_OPENAI.equals(llm.getProvider())) {
            return llm.getApiKey() != null && !llm.getApiKey().isBlank();
        }
        return true;
    }

    private ChatRequest buildChatRequest(LlmRequest request) {
        if (request.isThink() && !thinkWarned) {
            thinkWarned = true;
            log.warn("[LLM] Thinking mode is not supported by this adapter, ignoring");
        }
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request));
        if (request.hasTools()) {
            List<ToolSpecification> tools = convertTools(request);
            log.trace("Calling LLM with {} tools", tools.size());
            builder.toolSpecifications(tools);
        }
        if (request.isJsonResponse()) {
            builder.responseFormat(ResponseFormat.JSON);
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> addUserMessage(messages, msg.getContent());
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    String text = msg.getContent();
                    messages.add(text != null && !text.isBlank()
                            ? AiMessage.from(text, toolRequests)
                            : AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                addUserMessage(messages, msg.getContent());
            }
            }
        }
        return messages;
    }

    // UserMessage rejects blank text
    private static void addUserMessage(List<ChatMessage> messages, String content) {
        if (content == null || content.isBlank()) {
            log.debug("Skipping blank user message");
            return;
        }
        messages.add(UserMessage.from(content));
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> schemaProperties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (schemaProperties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : schemaProperties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            return JsonIntegerSchema.builder().description(description).build();
        }
        case "number" -> {
            return JsonNumberSchema.builder().description(description).build();
        }
        case "boolean" -> {
            return JsonBooleanSchema.builder().description(description).build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // Fallback to string for unknown types
            return JsonStringSchema.builder().description(description).build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<LlmToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> LlmToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(properties.getLlm().getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }
}

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
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the active LLM adapter based on {@code zenbot.llm.provider}:
 * <ul>
 * <li>ollama - local Ollama server via langchain4j
 * <li>openai - OpenAI or any OpenAI-compatible endpoint via langchain4j
 * <li>none - no-op adapter
 * </ul>
 *
 * <p>
 * All adapters are Spring beans; selection happens in {@link #init()}. A
 * provider that no adapter supports fails startup.
 *
 * @see LlmProviderAdapter
 * @see Langchain4jAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final BotProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String provider = properties.getLlm().getProvider();
        activeAdapter = findAdapter(provider);
        if (activeAdapter == null) {
            throw new IllegalStateException("No LLM adapter available for provider: " + provider);
        }
        log.info("Active LLM provider: {}", provider);
    }

    private LlmProviderAdapter findAdapter(String provider) {
        for (LlmProviderAdapter adapter : adapters) {
            if (adapter.supportsProvider(provider)) {
                return adapter;
            }
        }
        return null;
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return activeAdapter.chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return activeAdapter.chatStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        return activeAdapter != null && activeAdapter.supportsStreaming();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}

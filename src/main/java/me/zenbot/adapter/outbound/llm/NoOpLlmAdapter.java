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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when {@code zenbot.llm.provider=none}. Always
 * answers with a placeholder.
 *
 * <p>
 * Provider ID: {@code "none"}
 *
 * @see LlmProviderAdapter
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public boolean supportsProvider(String provider) {
        return "none".equals(provider);
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.just(LlmChunk.builder()
                .text(PLACEHOLDER)
                .done(true)
                .build());
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}

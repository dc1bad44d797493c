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

package me.zenbot.port.outbound;

import me.zenbot.domain.model.LlmChunk;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language-model backend. Implementations map a model id, the
 * full message list and the tool schema to an assistant reply, either in one
 * piece or as a stream of chunks.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "ollama", "openai").
     */
    String getProviderId();

    /**
     * Sends a request and returns the complete reply.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Sends a request and streams the reply. Tool calls, if any, arrive on the
     * final chunk.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    boolean supportsStreaming();

    String getCurrentModel();

    boolean isAvailable();
}

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

import me.zenbot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the system prompt: a user override file first, then the bundled
 * default, then a one-line fallback.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemPromptService {

    static final String DEFAULT_PROMPT_RESOURCE = "prompts/default_system.md";
    static final String FALLBACK_PROMPT = "You are a helpful AI assistant.";

    private final BotProperties properties;

    public String loadSystemPrompt() {
        String systemPath = properties.getPrompts().getSystemPath();
        if (systemPath != null && !systemPath.isBlank()) {
            Path overridePath = Paths.get(systemPath);
            if (Files.isRegularFile(overridePath)) {
                try {
                    String content = Files.readString(overridePath, StandardCharsets.UTF_8).strip();
                    if (!content.isEmpty()) {
                        log.info("[Prompt] Using system prompt from {}", overridePath.toAbsolutePath());
                        return content;
                    }
                } catch (IOException e) {
                    log.warn("[Prompt] Failed to read {}: {}", overridePath, e.getMessage());
                }
            }
        }

        Resource resource = new ClassPathResource(DEFAULT_PROMPT_RESOURCE);
        if (resource.exists()) {
            try (InputStream in = resource.getInputStream()) {
                String content = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
                if (!content.isEmpty()) {
                    log.debug("[Prompt] Using bundled system prompt");
                    return content;
                }
            } catch (IOException e) {
                log.warn("[Prompt] Failed to read bundled prompt: {}", e.getMessage());
            }
        }

        log.warn("[Prompt] No system prompt found, using fallback");
        return FALLBACK_PROMPT;
    }
}

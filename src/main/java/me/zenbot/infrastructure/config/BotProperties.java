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

package me.zenbot.infrastructure.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code zenbot.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model backend settings</li>
 * <li>{@link AgentProperties} - state machine limits</li>
 * <li>{@link RemindersProperties} - reminder polling and storage file</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link PromptsProperties} - system prompt override</li>
 * </ul>
 *
 * <p>
 * Values are checked once after binding; an invalid value stops startup.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "zenbot")
@Data
public class BotProperties {

    private static final Set<String> PROVIDERS = Set.of("ollama", "openai", "none");

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private RemindersProperties reminders = new RemindersProperties();
    private StorageProperties storage = new StorageProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @PostConstruct
    public void validate() {
        if (llm.getProvider() == null || !PROVIDERS.contains(llm.getProvider())) {
            throw new IllegalStateException("zenbot.llm.provider must be one of ollama, openai, none, got "
                    + llm.getProvider());
        }
        if (llm.getModel() == null || llm.getModel().isBlank()) {
            throw new IllegalStateException("zenbot.llm.model must not be blank");
        }
        if (agent.getMaxInternalSteps() <= 0) {
            throw new IllegalStateException("zenbot.agent.max-internal-steps must be > 0, got "
                    + agent.getMaxInternalSteps());
        }
        if (agent.getMaxHistoryMessages() < 2) {
            throw new IllegalStateException("zenbot.agent.max-history-messages must be >= 2, got "
                    + agent.getMaxHistoryMessages());
        }
        if (reminders.getPollSeconds() <= 0) {
            throw new IllegalStateException("zenbot.reminders.poll-seconds must be > 0, got "
                    + reminders.getPollSeconds());
        }
    }

    @Data
    public static class LlmProperties {
        private String provider = "ollama";
        private String model = "ministral-3:14b";
        private String baseUrl;
        private String apiKey;
        private boolean stream = true;
        private boolean think = false;
        private int timeoutMs = 120_000;
        private Double temperature;
    }

    @Data
    public static class AgentProperties {
        private int maxInternalSteps = 8;
        private int maxHistoryMessages = 20;
        private boolean debug = false;
    }

    @Data
    public static class RemindersProperties {
        private int pollSeconds = 30;
        private String directory = "reminders";
        private String file = "reminders.json";
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.zenbot";
    }

    @Data
    public static class PromptsProperties {
        private String systemPath = "config/system.md";
    }
}

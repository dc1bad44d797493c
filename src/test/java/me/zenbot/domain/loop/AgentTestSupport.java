package me.zenbot.domain.loop;

import me.zenbot.domain.service.SystemPromptService;
import me.zenbot.domain.service.Toolbox;
import me.zenbot.infrastructure.config.AutoConfiguration;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.LlmPort;
import me.zenbot.port.outbound.OutputPort;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Builds agents wired with test doubles. Streaming is off unless a test turns
 * it on through {@link Agent#getLlmSettings()}.
 */
public final class AgentTestSupport {

    public static final String SYSTEM_PROMPT = "You are a test assistant.";
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneId.of("UTC"));

    private AgentTestSupport() {
    }

    public static Agent agent(Toolbox toolbox, LlmPort llmPort, OutputPort output, int maxSteps, int maxHistory) {
        BotProperties properties = new BotProperties();
        properties.getLlm().setStream(false);
        properties.getAgent().setMaxInternalSteps(maxSteps);
        properties.getAgent().setMaxHistoryMessages(maxHistory);

        SystemPromptService promptService = mock(SystemPromptService.class);
        when(promptService.loadSystemPrompt()).thenReturn(SYSTEM_PROMPT);

        return new Agent(properties, toolbox, llmPort, output, promptService,
                AutoConfiguration.objectMapper(), FIXED_CLOCK);
    }
}

package me.zenbot.domain.service;

import me.zenbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SystemPromptServiceTest {

    @TempDir
    Path tempDir;

    private SystemPromptService serviceFor(Path overridePath) {
        BotProperties properties = new BotProperties();
        properties.getPrompts().setSystemPath(overridePath.toString());
        return new SystemPromptService(properties);
    }

    @Test
    void shouldPreferOverrideFile() throws IOException {
        Path override = tempDir.resolve("system.md");
        Files.writeString(override, "  Custom prompt.\n");

        assertEquals("Custom prompt.", serviceFor(override).loadSystemPrompt());
    }

    @Test
    void shouldUseBundledPromptWhenOverrideMissing() {
        String prompt = serviceFor(tempDir.resolve("missing.md")).loadSystemPrompt();

        assertTrue(prompt.startsWith("You are ZenBot"));
    }

    @Test
    void shouldIgnoreBlankOverride() throws IOException {
        Path override = tempDir.resolve("system.md");
        Files.writeString(override, "   \n");

        String prompt = serviceFor(override).loadSystemPrompt();

        assertNotEquals("", prompt);
        assertNotEquals(SystemPromptService.FALLBACK_PROMPT, prompt);
    }
}

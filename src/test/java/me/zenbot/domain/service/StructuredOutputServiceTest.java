package me.zenbot.domain.service;

import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.infrastructure.config.AutoConfiguration;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.LlmPort;
import me.zenbot.tools.SetReminderTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StructuredOutputServiceTest {

    private LlmPort llmPort;
    private StructuredOutputService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        service = new StructuredOutputService(llmPort, new BotProperties(), AutoConfiguration.objectMapper());
    }

    private void reply(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }

    @Test
    void shouldRequestJsonAndMapReply() {
        reply("{\"task\":\"drink water\",\"time\":\"14:45\",\"intended_date\":\"today\",\"notes\":null}");

        Optional<SetReminderTool.ReminderRequest> result = service.extract("sys", "remind me",
                SetReminderTool.ReminderRequest.class);

        assertTrue(result.isPresent());
        assertEquals("drink water", result.get().task());
        assertEquals("today", result.get().intendedDate());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().isJsonResponse());
        assertFalse(captor.getValue().hasTools());
        assertEquals(2, captor.getValue().getMessages().size());
    }

    @Test
    void shouldStripCodeFence() {
        reply("```json\n{\"confirmation_message\":\"Done!\"}\n```");

        Optional<SetReminderTool.ReminderConfirmation> result = service.extract("sys", "user",
                SetReminderTool.ReminderConfirmation.class);

        assertEquals("Done!", result.map(SetReminderTool.ReminderConfirmation::confirmationMessage).orElse(null));
    }

    @Test
    void shouldRejectInvalidValue() {
        reply("{\"task\":\"\",\"time\":\"14:45\",\"intended_date\":\"today\"}");

        assertTrue(service.extract("sys", "user", SetReminderTool.ReminderRequest.class).isEmpty());
    }

    @Test
    void shouldReturnEmptyOnMalformedJson() {
        reply("sure, here you go");

        assertTrue(service.extract("sys", "user", SetReminderTool.ReminderConfirmation.class).isEmpty());
    }

    @Test
    void shouldReturnEmptyOnBackendFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(service.extract("sys", "user", SetReminderTool.ReminderConfirmation.class).isEmpty());
    }

    @Test
    void shouldReturnEmptyOnBlankReply() {
        reply("  ");

        assertTrue(service.extract("sys", "user", SetReminderTool.ReminderConfirmation.class).isEmpty());
    }
}

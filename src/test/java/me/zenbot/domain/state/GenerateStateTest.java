package me.zenbot.domain.state;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.loop.AgentTestSupport;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.LlmChunk;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.LlmToolCall;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.service.Toolbox;
import me.zenbot.infrastructure.config.AutoConfiguration;
import me.zenbot.port.outbound.LlmPort;
import me.zenbot.port.outbound.OutputPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GenerateStateTest {

    private LlmPort llmPort;
    private OutputPort output;
    private Agent agent;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        output = mock(OutputPort.class);
        ToolComponent tool = mock(ToolComponent.class);
        when(tool.getToolName()).thenReturn("datetime");
        when(tool.getDefinition()).thenReturn(ToolDefinition.simple("datetime", "Now"));
        agent = AgentTestSupport.agent(new Toolbox(List.of(tool)), llmPort, output, 8, 20);
        agent.getTurn().setUserText("hello");
    }

    @Test
    void shouldSeedWorkingMessagesFromHistoryAndSendTools() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Hi").build()));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(CleanupState.INSTANCE, next);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(2, request.getMessages().size());
        assertTrue(request.getMessages().get(0).isSystemMessage());
        assertEquals("hello", request.getMessages().get(1).getContent());
        assertEquals(1, request.getTools().size());
        assertFalse(request.isStream());
        assertEquals("Hi", agent.getTurn().getAssistantText());
        verify(output).emitText("Hi");
    }

    @Test
    void shouldNotSendBlankUserText() {
        agent.getTurn().setUserText("");
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Reminder: stretch").build()));

        GenerateState.INSTANCE.handle(agent, Event.tick());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        List<Message> messages = captor.getValue().getMessages();
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).isSystemMessage());
    }

    @Test
    void shouldFallBackToBlockingCallWhenBackendCannotStream() {
        agent.getLlmSettings().setStream(true);
        when(llmPort.supportsStreaming()).thenReturn(false);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Hi").build()));

        GenerateState.INSTANCE.handle(agent, Event.tick());

        verify(llmPort, never()).chatStream(any());
        verify(output).emitText("Hi");
        assertFalse(agent.getTurn().isAssistantStreamed());
    }

    @Test
    void nonTickEventShouldBeIgnored() {
        assertSame(GenerateState.INSTANCE, GenerateState.INSTANCE.handle(agent, Event.userMessage("x")));
        verifyNoInteractions(llmPort);
    }

    @Test
    void shouldStreamTextWithoutEmittingItAgain() {
        agent.getLlmSettings().setStream(true);
        when(llmPort.supportsStreaming()).thenReturn(true);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.text("Hel"), LlmChunk.text("lo"), LlmChunk.builder().done(true).build()));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(CleanupState.INSTANCE, next);
        InOrder order = inOrder(output);
        order.verify(output).beginStream();
        order.verify(output).emitStreamChunk("Hel");
        order.verify(output).emitStreamChunk("lo");
        order.verify(output).endStream();
        verify(output, never()).emitText(anyString());
        assertEquals("Hello", agent.getTurn().getAssistantText());
        assertTrue(agent.getTurn().isAssistantStreamed());
    }

    @Test
    void shouldCloseStreamWhenBackendFailsMidway() {
        agent.getLlmSettings().setStream(true);
        when(llmPort.supportsStreaming()).thenReturn(true);
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(LlmChunk.text("Par")),
                Flux.error(new IllegalStateException("connection reset"))));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(CleanupState.INSTANCE, next);
        verify(output).endStream();
        verify(output).emitText(GenerateState.BACKEND_ERROR_MESSAGE);
        assertEquals(GenerateState.BACKEND_ERROR_MESSAGE, agent.getTurn().getAssistantText());
        assertFalse(agent.getTurn().isAssistantStreamed());
    }

    @Test
    void streamedToolCallsShouldMoveToUseTools() {
        agent.getLlmSettings().setStream(true);
        when(llmPort.supportsStreaming()).thenReturn(true);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(LlmChunk.builder()
                .toolCalls(List.of(LlmToolCall.builder().id("c1").name("datetime").arguments("{}").build()))
                .done(true)
                .build()));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(UseToolsState.INSTANCE, next);
        verify(output, never()).beginStream();
        assertEquals(1, agent.getTurn().getPendingToolCalls().size());
    }

    @Test
    void shouldQueueToolCallsAndRecordAssistantMessage() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .toolCalls(List.of(
                        LlmToolCall.builder().id("c1").name("datetime").arguments("{\"timezone\":\"UTC\"}").build(),
                        LlmToolCall.builder().name("datetime").arguments(Map.of()).build()))
                .build()));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(UseToolsState.INSTANCE, next);
        assertEquals(2, agent.getTurn().getPendingToolCalls().size());
        Message.ToolCall first = agent.getTurn().getPendingToolCalls().peekFirst();
        assertEquals("c1", first.getId());
        assertEquals("UTC", first.getArguments().get("timezone"));
        Message.ToolCall second = agent.getTurn().getPendingToolCalls().peekLast();
        assertTrue(second.getId().startsWith("call_"));
        Message last = agent.getTurn().getWorkingMessages().get(agent.getTurn().getWorkingMessages().size() - 1);
        assertTrue(last.hasToolCalls());
        verify(output, never()).emitText(anyString());
    }

    @Test
    void unusableToolCallsShouldBeTreatedAsText() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .content("Plain answer")
                .toolCalls(List.of(LlmToolCall.builder().id("c1").name("  ").build()))
                .build()));

        AgentState next = GenerateState.INSTANCE.handle(agent, Event.tick());

        assertSame(CleanupState.INSTANCE, next);
        verify(output).emitText("Plain answer");
    }

    @Test
    void parseArgumentsShouldAcceptMapOrJsonAndDefaultToEmpty() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("UTC", GenerateState.parseArguments(Map.of("timezone", "UTC"), mapper).get("timezone"));
        assertEquals(3, GenerateState.parseArguments("{\"n\":3}", mapper).get("n"));
        assertTrue(GenerateState.parseArguments("not json", mapper).isEmpty());
        assertTrue(GenerateState.parseArguments("", mapper).isEmpty());
        assertTrue(GenerateState.parseArguments(null, mapper).isEmpty());
        assertTrue(GenerateState.parseArguments(42, mapper).isEmpty());
    }
}

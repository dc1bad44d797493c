package me.zenbot.domain.loop;

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.LlmRequest;
import me.zenbot.domain.model.LlmResponse;
import me.zenbot.domain.model.LlmToolCall;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.model.ToolResults;
import me.zenbot.domain.service.Toolbox;
import me.zenbot.domain.state.AgentState;
import me.zenbot.domain.state.GenerateState;
import me.zenbot.domain.state.IdleState;
import me.zenbot.port.outbound.LlmPort;
import me.zenbot.port.outbound.OutputPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentTest {

    private LlmPort llmPort;
    private OutputPort output;
    private ToolComponent reminderTool;
    private Agent agent;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        output = mock(OutputPort.class);
        reminderTool = mock(ToolComponent.class);
        when(reminderTool.getToolName()).thenReturn("set_reminder");
        when(reminderTool.getDefinition()).thenReturn(ToolDefinition.simple("set_reminder", "Set a reminder"));
        when(reminderTool.getUserMessage()).thenReturn("Setting your reminder...");

        agent = AgentTestSupport.agent(new Toolbox(List.of(reminderTool)), llmPort, output, 8, 20);
    }

    private static LlmResponse text(String content) {
        return LlmResponse.builder().content(content).build();
    }

    private static LlmResponse toolCall(String id, String name, Object arguments) {
        return LlmResponse.builder()
                .content("")
                .toolCalls(List.of(LlmToolCall.builder().id(id).name(name).arguments(arguments).build()))
                .build();
    }

    @Test
    void shouldAnswerPlainMessageAndCommitToHistory() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(text("Hi there!")));

        agent.enqueueEvent(Event.userMessage("  hello  "));
        assertTrue(agent.processNextQueuedEvent());

        verify(output).emitText("Hi there!");
        assertInstanceOf(IdleState.class, agent.getCurrentState());
        assertNull(agent.getPendingNext());
        List<Message> messages = agent.getHistory().getMessages();
        assertEquals(3, messages.size());
        assertEquals("hello", messages.get(1).getContent());
        assertEquals(Message.ROLE_ASSISTANT, messages.get(2).getRole());
        assertEquals("Hi there!", messages.get(2).getContent());
        assertTrue(agent.getTurn().isEmpty());
    }

    @Test
    void shouldRunToolAndAskModelAgainWhenNoDirectResponse() {
        ToolComponent datetime = mock(ToolComponent.class);
        when(datetime.getToolName()).thenReturn("datetime");
        when(datetime.getDefinition()).thenReturn(ToolDefinition.simple("datetime", "Now"));
        Map<String, Object> now = ToolResults.success();
        now.put("time", "12:00:00");
        when(datetime.execute(any())).thenReturn(now);
        agent.getToolbox().register(datetime);

        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCall("call_1", "datetime", "{}")))
                .thenReturn(CompletableFuture.completedFuture(text("It is noon.")));

        agent.enqueueEvent(Event.userMessage("what time is it?"));
        agent.processNextQueuedEvent();

        ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(requests.capture());
        List<Message> second = requests.getAllValues().get(1).getMessages();
        Message last = second.get(second.size() - 1);
        assertTrue(last.isToolMessage());
        assertEquals("call_1", last.getToolCallId());
        assertTrue(last.getContent().contains("12:00:00"));
        assertTrue(second.get(second.size() - 2).hasToolCalls());

        verify(output).emitText("It is noon.");
        assertEquals(3, agent.getHistory().size());
        assertEquals("It is noon.", agent.getHistory().getMessages().get(2).getContent());
    }

    @Test
    void shouldUseDirectResponseWithoutSecondModelCall() {
        Map<String, Object> result = ToolResults.success();
        result.put("confirmation", "Done! I'll remind you at 14:45.");
        when(reminderTool.execute(any())).thenReturn(result);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                toolCall("call_1", "set_reminder", Map.of())));

        agent.enqueueEvent(Event.userMessage("remind me to drink water at 14:45"));
        agent.processNextQueuedEvent();

        verify(llmPort, times(1)).chat(any());
        verify(output).emitStatus("Setting your reminder...");
        verify(output).emitText("Done! I'll remind you at 14:45.");
        List<Message> messages = agent.getHistory().getMessages();
        assertEquals("Done! I'll remind you at 14:45.", messages.get(messages.size() - 1).getContent());
        assertInstanceOf(IdleState.class, agent.getCurrentState());
    }

    @Test
    void shouldAbandonTurnWhenStepBudgetIsSpent() {
        AgentState looping = new AgentState() {
            @Override
            public String getName() {
                return "LOOP";
            }

            @Override
            public AgentState handle(Agent a, Event event) {
                return this;
            }
        };
        Agent limited = AgentTestSupport.agent(new Toolbox(List.of()), llmPort, output, 1, 20);
        limited.getTurn().setUserText("pending");
        limited.setCurrentState(looping);

        limited.dispatch(Event.userMessage("go"));
        limited.drain();

        verify(output, times(1)).emitText(Agent.STEP_LIMIT_MESSAGE);
        assertInstanceOf(IdleState.class, limited.getCurrentState());
        assertNull(limited.getPendingNext());
        assertTrue(limited.getTurn().isEmpty());
        assertEquals(1, limited.getHistory().size());
    }

    @Test
    void shouldReturnToIdleWhenHandlerReturnsNoState() {
        AgentState broken = new AgentState() {
            @Override
            public String getName() {
                return "BROKEN";
            }

            @Override
            public AgentState handle(Agent a, Event event) {
                return null;
            }
        };
        AgentState start = new AgentState() {
            @Override
            public String getName() {
                return "START";
            }

            @Override
            public AgentState handle(Agent a, Event event) {
                return broken;
            }
        };
        agent.getTurn().setUserText("partial");
        agent.setCurrentState(start);

        agent.dispatch(Event.userMessage("go"));
        agent.drain();

        verify(output).emitText(Agent.INTERNAL_ERROR_MESSAGE);
        assertInstanceOf(IdleState.class, agent.getCurrentState());
        assertNull(agent.getPendingNext());
        assertFalse(agent.isBusy());
        assertTrue(agent.getTurn().isEmpty());
    }

    @Test
    void shouldFinishQuietlyWhenLastStepReachesIdle() {
        Agent tight = AgentTestSupport.agent(new Toolbox(List.of()), llmPort, output, 2, 20);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(text("Short answer.")));

        tight.enqueueEvent(Event.userMessage("quick question"));
        tight.processNextQueuedEvent();

        verify(output, never()).emitText(Agent.STEP_LIMIT_MESSAGE);
        verify(output).emitText("Short answer.");
        assertInstanceOf(IdleState.class, tight.getCurrentState());
        assertNull(tight.getPendingNext());
        List<Message> messages = tight.getHistory().getMessages();
        assertEquals(3, messages.size());
        assertEquals("quick question", messages.get(1).getContent());
        assertEquals("Short answer.", messages.get(2).getContent());
    }

    @Test
    void shouldApologizeOnceWhenStateLoopsForever() {
        AtomicInteger ticks = new AtomicInteger();
        AgentState looping = new AgentState() {
            @Override
            public String getName() {
                return "LOOP";
            }

            @Override
            public AgentState handle(Agent a, Event event) {
                if (event.isTick()) {
                    ticks.incrementAndGet();
                }
                return this;
            }
        };
        Agent limited = AgentTestSupport.agent(new Toolbox(List.of()), llmPort, output, 4, 20);
        limited.setCurrentState(looping);

        limited.dispatch(Event.userMessage("go"));
        limited.drain();

        assertEquals(4, ticks.get());
        verify(output, times(1)).emitText(Agent.STEP_LIMIT_MESSAGE);
        verify(output, times(1)).emitText(any());
        assertInstanceOf(IdleState.class, limited.getCurrentState());
        assertNull(limited.getPendingNext());

        limited.drain();
        verify(output, times(1)).emitText(any());
    }

    @Test
    void drainShouldBeNoOpWhenIdle() {
        agent.drain();
        agent.drain();

        assertInstanceOf(IdleState.class, agent.getCurrentState());
        assertNull(agent.getPendingNext());
        verifyNoInteractions(output);
    }

    @Test
    void shouldContainHandlerExceptions() {
        AgentState failing = new AgentState() {
            @Override
            public String getName() {
                return "FAILING";
            }

            @Override
            public AgentState handle(Agent a, Event event) {
                throw new IllegalStateException("boom");
            }
        };
        agent.getTurn().setUserText("partial");
        agent.setCurrentState(failing);

        agent.dispatch(Event.userMessage("x"));
        agent.drain();

        verify(output).emitText(Agent.INTERNAL_ERROR_MESSAGE);
        assertInstanceOf(IdleState.class, agent.getCurrentState());
        assertTrue(agent.getTurn().isEmpty());
    }

    @Test
    void shouldApologizeWhenBackendFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        agent.enqueueEvent(Event.userMessage("hello"));
        agent.processNextQueuedEvent();

        verify(output).emitText(GenerateState.BACKEND_ERROR_MESSAGE);
        assertInstanceOf(IdleState.class, agent.getCurrentState());
    }

    @Test
    void shouldNotCommitWhenUserTextIsBlank() {
        agent.getTurn().setUserText("   ");
        agent.getTurn().setAssistantText("reply");

        agent.commitTurn();

        assertEquals(1, agent.getHistory().size());
        assertTrue(agent.getTurn().isEmpty());
    }

    @Test
    void shouldTrimHistoryOnCommit() {
        Agent small = AgentTestSupport.agent(new Toolbox(List.of()), llmPort, output, 8, 2);
        for (int i = 0; i < 3; i++) {
            small.getTurn().setUserText("q" + i);
            small.getTurn().setAssistantText("a" + i);
            small.commitTurn();
        }

        List<Message> messages = small.getHistory().getMessages();
        assertEquals(3, messages.size());
        assertTrue(messages.get(0).isSystemMessage());
        assertEquals("q2", messages.get(1).getContent());
        assertEquals("a2", messages.get(2).getContent());
    }

    @Test
    void shouldProcessEventsInOrderAndReportBusy() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(text("one")))
                .thenReturn(CompletableFuture.completedFuture(text("two")));

        assertFalse(agent.isBusy());
        agent.enqueueEvent(Event.userMessage("first"));
        agent.enqueueEvent(Event.userMessage("second"));
        assertTrue(agent.isBusy());

        assertEquals(2, agent.processQueuedEvents());

        List<String> contents = new ArrayList<>();
        for (Message message : agent.getHistory().getMessages()) {
            contents.add(message.getContent());
        }
        assertEquals(List.of("first", "one", "second", "two"), contents.subList(1, 5));
        assertFalse(agent.isBusy());
        assertFalse(agent.processNextQueuedEvent());
        verify(output, never()).emitText(Agent.STEP_LIMIT_MESSAGE);
    }
}

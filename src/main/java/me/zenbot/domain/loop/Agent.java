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

package me.zenbot.domain.loop;

import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.Message;
import me.zenbot.domain.model.Turn;
import me.zenbot.domain.service.SystemPromptService;
import me.zenbot.domain.service.Toolbox;
import me.zenbot.domain.state.AgentState;
import me.zenbot.domain.state.IdleState;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.LlmPort;
import me.zenbot.port.outbound.OutputPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Event-driven orchestrator for a single conversation.
 *
 * <p>
 * The agent owns the history, the current turn, the toolbox binding, the
 * current state and the event queue. Producers call
 * {@link #enqueueEvent(Event)} from any thread; a single consumer calls
 * {@link #processNextQueuedEvent()} which runs {@link #dispatch(Event)} and
 * then {@link #drain()}. Nothing else mutates agent state, so no locking is
 * needed around the turn or history.
 *
 * <p>
 * {@link #drain()} always leaves the agent in {@link IdleState} with no
 * pending transition. It advances at most {@code maxInternalSteps} states per
 * event; a chain that does not reach Idle within that budget is abandoned with
 * a message to the user. Exceptions thrown by state handlers are contained
 * here and never reach the caller.
 */
@Component
@Slf4j
public class Agent {

    public static final String STEP_LIMIT_MESSAGE = "I hit an internal step limit while processing that request. "
            + "Please split it into smaller steps and try again.";
    public static final String INTERNAL_ERROR_MESSAGE = "Sorry, something went wrong while processing that request.";

    private final BotProperties.LlmProperties llmSettings;
    private final int maxInternalSteps;
    private final Toolbox toolbox;
    private final LlmPort llmPort;
    private final OutputPort output;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ConversationHistory history;
    private final Turn turn = new Turn();
    private final EventQueue eventQueue = new EventQueue();

    private volatile AgentState currentState = IdleState.INSTANCE;
    private AgentState pendingNext;

    public Agent(BotProperties properties, Toolbox toolbox, LlmPort llmPort, OutputPort output,
            SystemPromptService systemPromptService, ObjectMapper objectMapper, Clock clock) {
        this.llmSettings = properties.getLlm();
        this.maxInternalSteps = properties.getAgent().getMaxInternalSteps();
        this.toolbox = toolbox;
        this.llmPort = llmPort;
        this.output = output;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.history = new ConversationHistory(systemPromptService.loadSystemPrompt(),
                properties.getAgent().getMaxHistoryMessages());
    }

    // ==================== Event intake ====================

    /**
     * Queues an event for the consumer. Safe from any thread.
     */
    public void enqueueEvent(Event event) {
        eventQueue.enqueue(event);
    }

    public boolean hasQueuedEvents() {
        return eventQueue.hasPending();
    }

    /**
     * Takes one queued event and runs it to Idle.
     *
     * @return false if the queue was empty
     */
    public boolean processNextQueuedEvent() {
        Event event = eventQueue.takeOne();
        if (event == null) {
            return false;
        }
        dispatch(event);
        drain();
        return true;
    }

    /**
     * Processes queued events until the queue is empty.
     *
     * @return number of events processed
     */
    public int processQueuedEvents() {
        int processed = 0;
        while (processNextQueuedEvent()) {
            processed++;
        }
        return processed;
    }

    /**
     * True while a turn is in flight or events are waiting.
     */
    public boolean isBusy() {
        return !(currentState instanceof IdleState) || eventQueue.hasPending();
    }

    // ==================== State machine ====================

    /**
     * Applies one external event to the current state and records the
     * resulting state as the pending transition. Does not transition.
     */
    public void dispatch(Event event) {
        log.debug("[Agent] Dispatching {} in state {}", event.type(), currentState.getName());
        pendingNext = safeHandle(currentState, event);
    }

    /**
     * Applies pending transitions, feeding ticks, until Idle is reached or the
     * step budget is spent. Returns with the agent Idle and nothing pending.
     */
    public void drain() {
        int steps = 0;
        while (pendingNext != null && steps < maxInternalSteps) {
            AgentState current = pendingNext;
            pendingNext = null;
            if (current != currentState) {
                log.debug("[Agent] {} -> {}", currentState.getName(), current.getName());
            }
            currentState = current;
            if (current instanceof IdleState) {
                break;
            }
            pendingNext = safeHandle(current, Event.tick());
            steps++;
        }

        if (pendingNext instanceof IdleState) {
            log.debug("[Agent] {} -> {}", currentState.getName(), pendingNext.getName());
            currentState = pendingNext;
            pendingNext = null;
        }

        if (pendingNext != null) {
            log.warn("[Agent] Step limit ({}) reached in state {}, abandoning turn",
                    maxInternalSteps, currentState.getName());
            output.emitText(STEP_LIMIT_MESSAGE);
            resetTurn();
            currentState = IdleState.INSTANCE;
            pendingNext = null;
        }

        if (currentState instanceof IdleState) {
            pendingNext = null;
        }
    }

    private AgentState safeHandle(AgentState state, Event event) {
        AgentState next;
        try {
            next = state.handle(this, event);
        } catch (Exception e) { // NOSONAR - no handler failure may escape the loop
            log.error("[Agent] State {} failed on {}", state.getName(), event.type(), e);
            return abandonTurn();
        }
        if (next == null) {
            log.error("[Agent] State {} returned no next state on {}", state.getName(), event.type());
            return abandonTurn();
        }
        return next;
    }

    private AgentState abandonTurn() {
        output.emitText(INTERNAL_ERROR_MESSAGE);
        resetTurn();
        return IdleState.INSTANCE;
    }

    // ==================== Turn lifecycle ====================

    /**
     * Appends the turn's exchange to history when both sides have text, trims
     * history and clears the turn.
     */
    public void commitTurn() {
        String userText = turn.getUserText() != null ? turn.getUserText().strip() : "";
        String assistantText = turn.getAssistantText() != null ? turn.getAssistantText().strip() : "";
        if (!userText.isEmpty() && !assistantText.isEmpty()) {
            history.append(Message.user(userText));
            history.append(Message.assistant(assistantText));
            history.trim();
            log.debug("[Agent] Committed turn, history size {}", history.size());
        }
        resetTurn();
    }

    public void resetTurn() {
        turn.reset();
    }

    // ==================== Accessors for states ====================

    public AgentState getCurrentState() {
        return currentState;
    }

    public AgentState getPendingNext() {
        return pendingNext;
    }

    /**
     * Replaces the current state without running it. Used to resume from a
     * known state.
     */
    public void setCurrentState(AgentState state) {
        this.currentState = state;
    }

    public Turn getTurn() {
        return turn;
    }

    public ConversationHistory getHistory() {
        return history;
    }

    public Toolbox getToolbox() {
        return toolbox;
    }

    public LlmPort getLlmPort() {
        return llmPort;
    }

    public OutputPort getOutput() {
        return output;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Clock getClock() {
        return clock;
    }

    public BotProperties.LlmProperties getLlmSettings() {
        return llmSettings;
    }

    public int getMaxInternalSteps() {
        return maxInternalSteps;
    }
}

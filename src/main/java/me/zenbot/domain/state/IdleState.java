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

package me.zenbot.domain.state;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.Turn;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rest state. Captures a user message or a due reminder into the turn and
 * hands off to {@link GenerateState} or {@link TaskState}.
 */
public final class IdleState implements AgentState {

    public static final IdleState INSTANCE = new IdleState();

    private IdleState() {
    }

    @Override
    public String getName() {
        return "IDLE";
    }

    @Override
    @SuppressWarnings("unchecked")
    public AgentState handle(Agent agent, Event event) {
        Turn turn = agent.getTurn();
        switch (event.type()) {
        case USER_MESSAGE -> {
            Object payload = event.payload();
            turn.setUserText(payload != null ? payload.toString().strip() : "");
            return GenerateState.INSTANCE;
        }
        case REMINDER_DUE -> {
            turn.setUserText("");
            Object payload = event.payload();
            turn.setReminderPayload(payload instanceof Map
                    ? new LinkedHashMap<>((Map<String, Object>) payload)
                    : new LinkedHashMap<>());
            return TaskState.INSTANCE;
        }
        default -> {
            return this;
        }
        }
    }
}

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

/**
 * A state of the agent. Handlers mutate the agent's turn and return the state
 * that should run next; they never apply the transition themselves.
 *
 * <p>
 * The built-in states are stateless singletons: {@link IdleState},
 * {@link GenerateState}, {@link UseToolsState}, {@link TaskState},
 * {@link CleanupState}.
 */
public interface AgentState {

    /**
     * Upper-case name used in logs (e.g., "GENERATE").
     */
    String getName();

    /**
     * Handles one event.
     *
     * @param agent
     *            the owning agent
     * @param event
     *            an external event or a synthetic tick
     * @return the next state, possibly {@code this}
     */
    AgentState handle(Agent agent, Event event);
}

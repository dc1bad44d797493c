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
 * Commits the finished turn into history and returns to Idle.
 */
public final class CleanupState implements AgentState {

    public static final CleanupState INSTANCE = new CleanupState();

    private CleanupState() {
    }

    @Override
    public String getName() {
        return "CLEANUP";
    }

    @Override
    public AgentState handle(Agent agent, Event event) {
        if (!event.isTick()) {
            return this;
        }
        agent.commitTurn();
        return IdleState.INSTANCE;
    }
}

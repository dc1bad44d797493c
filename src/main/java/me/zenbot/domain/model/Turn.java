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

package me.zenbot.domain.model;

import lombok.Data;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Scratch data for one conversation turn, from capturing the input to
 * committing the exchange into history.
 *
 * <p>
 * Owned by the agent and touched only from the consumer thread.
 * {@code workingMessages} is the exact message list sent to the model; once
 * seeded it only grows until {@link #reset()}.
 */
@Data
public class Turn {

    private String userText = "";
    private String assistantText = "";
    private Map<String, Object> reminderPayload;
    private boolean assistantStreamed;
    private final Deque<Message.ToolCall> pendingToolCalls = new ArrayDeque<>();
    private final List<ToolExecution> toolResults = new ArrayList<>();
    private final List<Message> workingMessages = new ArrayList<>();

    public void reset() {
        userText = "";
        assistantText = "";
        reminderPayload = null;
        assistantStreamed = false;
        pendingToolCalls.clear();
        toolResults.clear();
        workingMessages.clear();
    }

    public boolean isEmpty() {
        return userText.isEmpty()
                && assistantText.isEmpty()
                && reminderPayload == null
                && !assistantStreamed
                && pendingToolCalls.isEmpty()
                && toolResults.isEmpty()
                && workingMessages.isEmpty();
    }
}

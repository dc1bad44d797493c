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

import me.zenbot.domain.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded chat history. The system message is pinned at index 0 and never
 * trimmed; trimming keeps the most recent non-system messages in order.
 */
public class ConversationHistory {

    private final List<Message> messages = new ArrayList<>();
    private final int maxMessages;

    public ConversationHistory(String systemPrompt, int maxMessages) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.maxMessages = maxMessages;
        messages.add(Message.system(systemPrompt));
    }

    public void append(Message message) {
        messages.add(message);
    }

    /**
     * Drops the oldest non-system messages beyond the configured maximum.
     */
    public void trim() {
        int excess = nonSystemSize() - maxMessages;
        if (excess > 0) {
            messages.subList(1, 1 + excess).clear();
        }
    }

    public Message getSystemMessage() {
        return messages.get(0);
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public int nonSystemSize() {
        return messages.size() - 1;
    }
}

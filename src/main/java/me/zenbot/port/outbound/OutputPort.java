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

package me.zenbot.port.outbound;

/**
 * User-facing output sink. Called from the consumer thread while an input
 * thread may be reading; implementations serialize their own writes.
 */
public interface OutputPort {

    /**
     * Emits a complete assistant message.
     */
    void emitText(String text);

    /**
     * Emits a progress line such as a tool status.
     */
    void emitStatus(String text);

    void beginStream();

    void emitStreamChunk(String chunk);

    void endStream();
}

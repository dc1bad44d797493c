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

/**
 * Kinds of events the agent reacts to.
 */
public enum EventType {

    /**
     * Text typed by the user.
     */
    USER_MESSAGE,

    /**
     * A stored reminder reached its due time.
     */
    REMINDER_DUE,

    /**
     * Internal continuation signal. Never placed on the event queue.
     */
    TICK
}

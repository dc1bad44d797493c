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

package me.zenbot.domain.component;

import me.zenbot.domain.model.ToolDefinition;

import java.util.Map;

/**
 * Component representing an executable tool that can be invoked by the LLM.
 * Tools expose their JSON Schema definition to the LLM via function calling,
 * a short status line shown to the user while they run, and the execution
 * logic itself.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, and parameter schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Status line emitted to the user before the tool runs (e.g., "Setting your
     * reminder...").
     */
    String getUserMessage();

    /**
     * Executes the tool. Arguments have already been validated against the
     * definition's schema. The result is either a success map or a map holding
     * an {@code error} key; exceptions are converted to errors by the toolbox.
     *
     * @param arguments
     *            the validated arguments
     * @return the result map
     */
    Map<String, Object> execute(Map<String, Object> arguments);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}

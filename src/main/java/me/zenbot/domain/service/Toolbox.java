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

package me.zenbot.domain.service;

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.model.ToolResults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of tools available to the model.
 *
 * <p>
 * {@link #runTool(String, Map)} turns every outcome into a result map: unknown
 * tools, invalid arguments and exceptions thrown by a tool all come back as
 * maps with an {@code error} key. Nothing thrown by a tool escapes this class.
 */
@Service
@Slf4j
public class Toolbox {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final ToolArgumentValidator validator = new ToolArgumentValidator();

    public Toolbox(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            register(tool);
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    /**
     * Adds a tool.
     *
     * @throws IllegalStateException
     *             if a tool with the same name is already registered
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (tools.containsKey(name)) {
            throw new IllegalStateException("Tool already registered: " + name);
        }
        tools.put(name, tool);
    }

    public ToolComponent getTool(String name) {
        return tools.get(name);
    }

    public List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public Map<String, Object> runTool(String name, Map<String, Object> rawArgs) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            return ToolResults.failure("Tool not found: " + name);
        }

        ToolArgumentValidator.Validation validation = validator.validate(
                tool.getDefinition().getInputSchema(), rawArgs);
        if (!validation.isValid()) {
            log.warn("[Tools] Invalid arguments for {}: {}", name, validation.errors());
            return ToolResults.failure("Invalid arguments", validation.errors());
        }

        try {
            Map<String, Object> result = tool.execute(validation.arguments());
            log.debug("[Tools] {} finished: {}", name, result);
            return result != null ? result : ToolResults.failure("Tool returned no result: " + name);
        } catch (Exception e) { // NOSONAR - tool failures are reported to the model as data
            log.error("[Tools] {} failed", name, e);
            return ToolResults.failure(safeCauseMessage(e));
        }
    }

    private static String safeCauseMessage(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}

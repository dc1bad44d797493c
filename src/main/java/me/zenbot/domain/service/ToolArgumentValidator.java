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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates tool arguments against the subset of JSON Schema that tool
 * definitions use: {@code required}, per-property {@code type} and
 * {@code minLength}. Arguments not declared in {@code properties} are dropped.
 */
public class ToolArgumentValidator {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    /**
     * Outcome of validation: the accepted arguments, or the list of problems.
     */
    public record Validation(Map<String, Object> arguments, List<String> errors) {

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    @SuppressWarnings("unchecked")
    public Validation validate(Map<String, Object> schema, Map<String, Object> rawArgs) {
        Map<String, Object> args = rawArgs != null ? rawArgs : Map.of();
        if (schema == null) {
            return new Validation(new LinkedHashMap<>(args), List.of());
        }

        Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
        List<String> required = (List<String>) schema.get("required");
        List<String> errors = new ArrayList<>();

        if (required != null) {
            for (String name : required) {
                if (args.get(name) == null) {
                    errors.add(name + ": field required");
                }
            }
        }

        if (properties == null) {
            return new Validation(new LinkedHashMap<>(args), errors);
        }

        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            String name = entry.getKey();
            Object value = args.get(name);
            if (value == null) {
                continue;
            }
            Map<String, Object> propertySchema = (Map<String, Object>) entry.getValue();
            String problem = checkValue(value, propertySchema);
            if (problem != null) {
                errors.add(name + ": " + problem);
            } else {
                accepted.put(name, value);
            }
        }
        return new Validation(accepted, errors);
    }

    private String checkValue(Object value, Map<String, Object> propertySchema) {
        if (propertySchema == null) {
            return null;
        }
        String type = (String) propertySchema.get("type");
        if (type != null && !matchesType(value, type)) {
            return "expected " + type;
        }
        Object minLength = propertySchema.get("minLength");
        if (minLength instanceof Number && value instanceof String
                && ((String) value).length() < ((Number) minLength).intValue()) {
            return "must have at least " + minLength + " character(s)";
        }
        return null;
    }

    private boolean matchesType(Object value, String type) {
        return switch (type) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long;
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "object" -> value instanceof Map;
        case "array" -> value instanceof Collection;
        default -> true;
        };
    }
}

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for tool result maps. A result is either a failure carrying an
 * {@code error} key or a success map of tool-specific fields.
 */
public final class ToolResults {

    public static final String ERROR = "error";
    public static final String DETAILS = "details";
    public static final String SUCCESS = "success";

    private ToolResults() {
    }

    /**
     * Creates a failed result with an error message.
     */
    public static Map<String, Object> failure(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ERROR, error);
        return result;
    }

    /**
     * Creates a failed result with an error message and structured details.
     */
    public static Map<String, Object> failure(String error, Object details) {
        Map<String, Object> result = failure(error);
        result.put(DETAILS, details);
        return result;
    }

    /**
     * Starts a successful result; callers add their own fields.
     */
    public static Map<String, Object> success() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(SUCCESS, true);
        return result;
    }

    public static boolean isFailure(Map<String, Object> result) {
        return result == null || result.containsKey(ERROR);
    }
}

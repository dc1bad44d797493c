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

package me.zenbot.tools;

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.model.ToolResults;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns the current date/time in the requested timezone, or the clock's
 * zone when none is given. The result has no user-facing reply field, so the
 * model always phrases the answer.
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). "
                                                + "Default is the local timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public String getUserMessage() {
        return "Checking current date and time...";
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> parameters) {
        String timezone = (String) parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.strip());
            } catch (DateTimeException e) {
                return ToolResults.failure("Invalid timezone: " + timezone);
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        Map<String, Object> result = ToolResults.success();
        result.put("iso", now.toOffsetDateTime().toString());
        result.put("date", now.toLocalDate().toString());
        result.put("time", now.format(TIME_FORMAT));
        result.put("timestamp", now.toEpochSecond());
        result.put("timezone", zoneId.getId());
        result.put("dayOfWeek", now.getDayOfWeek().name());
        return result;
    }
}

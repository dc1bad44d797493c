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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic date and time rules for reminders. The model only extracts
 * what the user said; every calculation happens here against the injected
 * clock and its zone.
 */
@Service
@RequiredArgsConstructor
public class ReminderTimeService {

    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{1,2}):(\\d{2})\\s*(am|pm)?");
    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final DateTimeFormatter LOCAL_CONTEXT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    /**
     * Parses {@code 9:15}, {@code 9:15 AM}, {@code 3:45 pm} or {@code 14:30}.
     */
    public Optional<LocalTime> parseTime(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = TIME_PATTERN.matcher(text.strip().toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return Optional.empty();
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        String meridiem = matcher.group(3);

        if (minute > 59) {
            return Optional.empty();
        }
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            if ("pm".equals(meridiem) && hour != 12) {
                hour += 12;
            }
            if ("am".equals(meridiem) && hour == 12) {
                hour = 0;
            }
        } else if (hour > 23) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute));
    }

    /**
     * Resolves {@code today}, {@code tomorrow} or a weekday name. A weekday equal
     * to today means the same day next week.
     */
    public Optional<LocalDate> resolveDate(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        String text = expression.strip().toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);
        if ("today".equals(text)) {
            return Optional.of(today);
        }
        if ("tomorrow".equals(text)) {
            return Optional.of(today.plusDays(1));
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().toLowerCase(Locale.ROOT).equals(text)) {
                int daysAhead = Math.floorMod(day.getValue() - today.getDayOfWeek().getValue(), 7);
                return Optional.of(today.plusDays(daysAhead == 0 ? 7 : daysAhead));
            }
        }
        return Optional.empty();
    }

    public OffsetDateTime combine(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, clock.getZone()).toOffsetDateTime();
    }

    public boolean isPast(OffsetDateTime when) {
        return when != null && !when.toInstant().isAfter(clock.instant());
    }

    /**
     * Human label such as {@code Today at 09:15}, {@code Tomorrow at 18:00} or
     * {@code Friday at 07:30}, in the clock's zone.
     */
    public String formatWhen(OffsetDateTime when) {
        ZonedDateTime local = when.atZoneSameInstant(clock.getZone());
        LocalDate today = LocalDate.now(clock);
        LocalDate target = local.toLocalDate();

        String dayLabel;
        if (target.equals(today)) {
            dayLabel = "Today";
        } else if (target.equals(today.plusDays(1))) {
            dayLabel = "Tomorrow";
        } else {
            dayLabel = local.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        }
        return dayLabel + " at " + local.format(HOUR_MINUTE);
    }

    public String formatDate(LocalDate date) {
        return date.format(DAY_MONTH_YEAR);
    }

    public String formatTime(LocalTime time) {
        return time.format(HOUR_MINUTE);
    }

    /**
     * Current local date/time line given to the model as context.
     */
    public String currentLocalContext() {
        return ZonedDateTime.now(clock).format(LOCAL_CONTEXT);
    }
}

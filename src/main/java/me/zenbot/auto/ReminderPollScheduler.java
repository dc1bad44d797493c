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


package me.zenbot.auto;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.Reminder;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.ReminderStorePort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background producer that turns due reminders into {@code REMINDER_DUE}
 * events.
 *
 * <p>
 * Every {@code zenbot.reminders.poll-seconds} a daemon thread lists active
 * reminders, marks each one whose time has come as completed and enqueues it
 * on the agent. A reminder that cannot be marked is skipped and retried on the
 * next poll. A failed poll is logged and does not stop the schedule.
 *
 * @see ReminderStorePort
 */
@Component
@Slf4j
public class ReminderPollScheduler {

    private final ReminderStorePort reminderStore;
    private final Agent agent;
    private final Clock clock;
    private final int pollSeconds;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;

    public ReminderPollScheduler(ReminderStorePort reminderStore, Agent agent, Clock clock,
            BotProperties properties) {
        this.reminderStore = reminderStore;
        this.agent = agent;
        this.clock = clock;
        this.pollSeconds = properties.getReminders().getPollSeconds();
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-poller");
            t.setDaemon(true);
            return t;
        });
        pollTask = scheduler.scheduleAtFixedRate(this::safePoll, pollSeconds, pollSeconds, TimeUnit.SECONDS);
        log.info("[Reminders] Poller started with interval: {}s", pollSeconds);
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            log.info("[Reminders] Poller shut down");
        }
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) { // NOSONAR - an exception would cancel the fixed-rate task
            log.error("[Reminders] Poll failed", e);
        }
    }

    /**
     * Enqueues every active reminder that is due.
     *
     * @return number of reminders enqueued
     */
    public int pollOnce() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int enqueued = 0;
        for (Reminder reminder : reminderStore.listActive(false)) {
            if (reminder.getWhen() == null || reminder.getWhen().isAfter(now)) {
                continue;
            }
            if (!markCompleted(reminder)) {
                continue;
            }
            agent.enqueueEvent(Event.reminderDue(reminder.toDuePayload()));
            log.info("[Reminders] Reminder {} is due, queued", reminder.getId());
            enqueued++;
        }
        return enqueued;
    }

    private boolean markCompleted(Reminder reminder) {
        try {
            if (reminderStore.markCompleted(reminder.getId())) {
                return true;
            }
            log.warn("[Reminders] Reminder {} vanished before it could be marked, skipping", reminder.getId());
        } catch (RuntimeException e) {
            log.warn("[Reminders] Could not mark {} completed, skipping: {}", reminder.getId(), e.getMessage());
        }
        return false;
    }
}

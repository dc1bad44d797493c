package me.zenbot.auto;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.domain.model.EventType;
import me.zenbot.domain.model.Reminder;
import me.zenbot.infrastructure.config.BotProperties;
import me.zenbot.port.outbound.ReminderStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReminderPollSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneId.of("UTC"));

    private ReminderStorePort reminderStore;
    private Agent agent;
    private ReminderPollScheduler scheduler;

    private final Reminder due = Reminder.builder()
            .id("r1").task("drink water").when(OffsetDateTime.parse("2026-02-11T10:00Z")).notes("glass").build();
    private final Reminder future = Reminder.builder()
            .id("r2").task("call mom").when(OffsetDateTime.parse("2026-02-11T18:00Z")).build();

    @BeforeEach
    void setUp() {
        reminderStore = mock(ReminderStorePort.class);
        agent = mock(Agent.class);
        scheduler = new ReminderPollScheduler(reminderStore, agent, CLOCK, new BotProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldEnqueueDueRemindersAndMarkThemCompleted() {
        when(reminderStore.listActive(false)).thenReturn(List.of(future, due));
        when(reminderStore.markCompleted("r1")).thenReturn(true);

        int enqueued = scheduler.pollOnce();

        assertEquals(1, enqueued);
        verify(reminderStore).markCompleted("r1");
        verify(reminderStore, never()).markCompleted("r2");
        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(agent).enqueueEvent(captor.capture());
        assertEquals(EventType.REMINDER_DUE, captor.getValue().type());
        Map<String, Object> payload = (Map<String, Object>) captor.getValue().payload();
        assertEquals("r1", payload.get("id"));
        assertEquals("drink water", payload.get("task"));
        assertEquals("glass", payload.get("notes"));
    }

    @Test
    void shouldSkipReminderThatCannotBeMarked() {
        when(reminderStore.listActive(false)).thenReturn(List.of(due));
        when(reminderStore.markCompleted("r1")).thenThrow(new IllegalStateException("disk error"));

        assertEquals(0, scheduler.pollOnce());
        verify(agent, never()).enqueueEvent(any());
    }

    @Test
    void shouldSkipReminderThatVanished() {
        when(reminderStore.listActive(false)).thenReturn(List.of(due));
        when(reminderStore.markCompleted("r1")).thenReturn(false);

        assertEquals(0, scheduler.pollOnce());
        verify(agent, never()).enqueueEvent(any());
    }

    @Test
    void startAndShutdownShouldBeSafeToRepeat() {
        scheduler.start();
        scheduler.start();
        scheduler.shutdown();
        scheduler.shutdown();

        verifyNoInteractions(agent);
    }
}

package me.zenbot.adapter.outbound.storage;

import me.zenbot.domain.model.Reminder;
import me.zenbot.infrastructure.config.AutoConfiguration;
import me.zenbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonReminderStoreAdapterTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JsonReminderStoreAdapter store;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        clock = new MutableClock(Instant.parse("2026-02-11T10:00:00Z"));
        store = new JsonReminderStoreAdapter(storage, AutoConfiguration.objectMapper(), clock, properties);
    }

    private static OffsetDateTime at(String text) {
        return OffsetDateTime.parse(text);
    }

    @Test
    void addShouldPersistAcrossInstances() {
        Reminder added = store.add("  drink water ", at("2026-02-11T14:45+01:00"), "big glass");

        BotProperties properties = new BotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        JsonReminderStoreAdapter reopened = new JsonReminderStoreAdapter(storage,
                AutoConfiguration.objectMapper(), clock, properties);

        Optional<Reminder> loaded = reopened.getById(added.getId());
        assertTrue(loaded.isPresent());
        assertEquals("drink water", loaded.get().getTask());
        assertEquals("big glass", loaded.get().getNotes());
        assertTrue(loaded.get().getWhen().isEqual(at("2026-02-11T14:45+01:00")));
        assertFalse(loaded.get().isCompleted());
    }

    @Test
    void addShouldRejectBlankTaskOrMissingTime() {
        assertThrows(IllegalArgumentException.class, () -> store.add(" ", at("2026-02-11T14:45Z"), null));
        assertThrows(IllegalArgumentException.class, () -> store.add("task", null, null));
    }

    @Test
    void listActiveShouldReturnNewestFirstAndHideCompleted() {
        Reminder first = store.add("first", at("2026-02-12T09:00Z"), null);
        clock.advanceSeconds(60);
        Reminder second = store.add("second", at("2026-02-12T10:00Z"), null);

        assertTrue(store.markCompleted(first.getId()));

        List<Reminder> active = store.listActive(false);
        assertEquals(1, active.size());
        assertEquals(second.getId(), active.get(0).getId());

        List<Reminder> all = store.listActive(true);
        assertEquals(List.of(second.getId(), first.getId()), all.stream().map(Reminder::getId).toList());
    }

    @Test
    void deleteShouldRemoveOnlyExistingIds() {
        Reminder reminder = store.add("task", at("2026-02-12T09:00Z"), null);

        assertFalse(store.delete("unknown"));
        assertTrue(store.delete(reminder.getId()));
        assertTrue(store.getById(reminder.getId()).isEmpty());
        assertFalse(store.markCompleted(reminder.getId()));
    }

    @Test
    void corruptFileShouldFailLoudly() throws IOException {
        Files.writeString(tempDir.resolve("reminders/reminders.json"), "{not json");

        assertThrows(IllegalStateException.class, () -> store.listActive(false));
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

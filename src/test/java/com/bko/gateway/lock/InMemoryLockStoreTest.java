package com.bko.gateway.lock;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLockStoreTest {

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }
    }

    @Test
    void testSetIfAbsentIsExclusiveUntilDeleted() {
        InMemoryLockStore store = new InMemoryLockStore();

        assertTrue(store.setIfAbsent("k", Duration.ofHours(1)));
        assertFalse(store.setIfAbsent("k", Duration.ofHours(1)));
        store.delete("k");
        assertTrue(store.setIfAbsent("k", Duration.ofHours(1)));
    }

    @Test
    void testExpiredKeyCanBeTakenAgain() {
        MutableClock clock = new MutableClock();
        InMemoryLockStore store = new InMemoryLockStore(clock);

        assertTrue(store.setIfAbsent("k", Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(4));
        assertFalse(store.setIfAbsent("k", Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(2));
        assertTrue(store.setIfAbsent("k", Duration.ofMinutes(5)));
    }

    @Test
    void testDeleteOfMissingKeyIsHarmless() {
        InMemoryLockStore store = new InMemoryLockStore();
        assertDoesNotThrow(() -> store.delete("missing"));
    }
}

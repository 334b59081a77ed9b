package com.bko.gateway.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local lock store for single-instance deployments and tests.
 */
public class InMemoryLockStore implements LockStore {

    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLockStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLockStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean setIfAbsent(String key, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean();
        expiries.compute(key, (k, expiry) -> {
            if (expiry != null && expiry.isAfter(now)) {
                return expiry;
            }
            created.set(true);
            return now.plus(ttl);
        });
        return created.get();
    }

    @Override
    public void delete(String key) {
        expiries.remove(key);
    }
}

package com.bko.gateway.lock;

import com.bko.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-session exclusive lock serializing generations against one session.
 * <p>
 * The key expiry only guards against leaked locks; every owner releases explicitly.
 */
@Component
@Slf4j
public class SessionLock {

    private final LockStore store;
    private final String keyPrefix;
    private final Duration ttl;

    @Autowired
    public SessionLock(LockStore store, GatewayProperties properties) {
        this(store, properties.getLock().getKeyPrefix(), properties.getLock().getTtl());
    }

    SessionLock(LockStore store, String keyPrefix, Duration ttl) {
        this.store = store;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    public boolean acquire(String sessionId) {
        boolean acquired = store.setIfAbsent(key(sessionId), ttl);
        if (!acquired) {
            log.info("Session {} is already processing a request", sessionId);
        }
        return acquired;
    }

    public void release(String sessionId) {
        try {
            store.delete(key(sessionId));
        } catch (RuntimeException ex) {
            log.error("Failed to release lock for session {}; it expires after {}", sessionId, ttl, ex);
        }
    }

    String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}

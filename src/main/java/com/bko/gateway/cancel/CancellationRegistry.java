package com.bko.gateway.cancel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active generation tokens keyed by session id, so a stop request can reach a running turn.
 */
@Component
@Slf4j
public class CancellationRegistry {

    private final Map<String, CancellationToken> active = new ConcurrentHashMap<>();

    public CancellationToken register(String sessionId) {
        CancellationToken token = new CancellationToken();
        CancellationToken previous = active.put(sessionId, token);
        if (previous != null) {
            log.warn("Replacing an active cancellation token for session {}", sessionId);
        }
        return token;
    }

    public void deregister(String sessionId, CancellationToken token) {
        active.remove(sessionId, token);
    }

    public boolean stop(String sessionId) {
        CancellationToken token = active.remove(sessionId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Stop requested for session {}", sessionId);
        return true;
    }

    public boolean isActive(String sessionId) {
        return active.containsKey(sessionId);
    }
}

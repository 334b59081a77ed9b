package com.bko.gateway.generation;

import com.bko.gateway.error.GenerationException;

public class SessionBusyException extends GenerationException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Session " + sessionId + " is already processing a request");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

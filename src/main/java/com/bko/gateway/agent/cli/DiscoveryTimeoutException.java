package com.bko.gateway.agent.cli;

import com.bko.gateway.error.GenerationException;

import java.time.Duration;

public class DiscoveryTimeoutException extends GenerationException {

    public DiscoveryTimeoutException(String message) {
        super(message);
    }

    public static DiscoveryTimeoutException forSessionFile(String agentSessionId, Duration timeout) {
        return new DiscoveryTimeoutException("No session log for agent session " + agentSessionId
                + " appeared within " + timeout.toSeconds() + "s.");
    }

    public static DiscoveryTimeoutException forAnnouncement(Duration timeout) {
        return new DiscoveryTimeoutException("Agent did not announce a session id within "
                + timeout.toSeconds() + "s.");
    }
}

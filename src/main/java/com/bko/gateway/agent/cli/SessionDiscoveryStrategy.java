package com.bko.gateway.agent.cli;

import com.bko.gateway.cancel.CancellationToken;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Correlates a running agent process with the log file it writes.
 */
public interface SessionDiscoveryStrategy {

    /**
     * Extracts the agent's session id from a line of its diagnostic output.
     */
    Optional<String> parseSessionId(String diagnosticLine);

    /**
     * Looks for an existing log file for {@code agentSessionId} without waiting.
     */
    Optional<Path> find(String agentSessionId) throws IOException;

    /**
     * Waits for the log file of {@code agentSessionId} to appear.
     *
     * @throws DiscoveryTimeoutException if nothing appears within {@code timeout}
     * @throws java.util.concurrent.CancellationException if {@code cancellation} fires first
     */
    Path await(String agentSessionId, Duration timeout, CancellationToken cancellation)
            throws IOException, InterruptedException;
}

package com.bko.gateway.agent;

import com.bko.gateway.stream.EventSink;

/**
 * Runs one turn of a coding agent and reports its output as events.
 */
public interface AgentBackend {

    AgentKind kind();

    /**
     * Runs the turn to completion. Returning normally means the turn is done, including when it was cancelled;
     * the completion sentinel is written by the caller.
     *
     * @param turn the turn to run
     * @param sink receives the agent's events in order
     * @throws Exception any failure that should fail the turn
     */
    void run(AgentTurn turn, EventSink sink) throws Exception;
}

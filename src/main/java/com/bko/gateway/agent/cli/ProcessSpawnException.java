package com.bko.gateway.agent.cli;

import com.bko.gateway.error.GenerationException;

public class ProcessSpawnException extends GenerationException {

    public ProcessSpawnException(String executable, Throwable cause) {
        super("Failed to start agent process '" + executable + "': " + cause.getMessage(), cause);
    }
}

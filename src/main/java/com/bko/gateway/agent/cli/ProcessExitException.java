package com.bko.gateway.agent.cli;

import com.bko.gateway.error.GenerationException;

public class ProcessExitException extends GenerationException {

    private final int exitCode;

    public ProcessExitException(String executable, int exitCode) {
        super(executable + " exited with code " + exitCode);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}

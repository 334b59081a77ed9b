package com.bko.gateway.error;

/**
 * Base type for failures of the generation pipeline that callers are expected to tell apart.
 */
public abstract class GenerationException extends RuntimeException {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

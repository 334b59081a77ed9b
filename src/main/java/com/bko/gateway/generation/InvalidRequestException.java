package com.bko.gateway.generation;

import com.bko.gateway.error.GenerationException;

import java.util.List;

public class InvalidRequestException extends GenerationException {

    private final List<String> details;

    public InvalidRequestException(List<String> details) {
        super("Validation failed: " + String.join("; ", details));
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}

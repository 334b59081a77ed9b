package com.bko.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String error,
        String message,
        List<String> details,
        Instant timestamp
) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, List.of(), Instant.now());
    }

    public static ErrorResponse of(String error, String message, List<String> details) {
        return new ErrorResponse(error, message, details, Instant.now());
    }
}

package com.bko.gateway.stream;

import java.time.Instant;

/**
 * One buffered job event. {@code payload} is the JSON text handed to consumers unchanged.
 */
public record StreamEvent(
        long id,
        Instant timestamp,
        String payload
) {
}

package com.bko.gateway.api;

import java.time.Instant;

public record StopGenerationResponse(
        boolean stopped,
        String sessionId,
        Instant timestamp
) {
}

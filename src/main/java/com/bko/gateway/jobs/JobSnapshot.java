package com.bko.gateway.jobs;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record JobSnapshot(
        String taskId,
        String sessionId,
        JobStatus status,
        Instant createdAt,
        @Nullable Instant startedAt,
        @Nullable Instant finishedAt,
        @Nullable String error,
        int eventCount
) {
}

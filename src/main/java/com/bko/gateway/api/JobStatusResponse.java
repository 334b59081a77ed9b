package com.bko.gateway.api;

import com.bko.gateway.jobs.JobSnapshot;
import com.bko.gateway.jobs.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String taskId,
        String sessionId,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String error,
        int eventCount
) {

    public static JobStatusResponse from(JobSnapshot snapshot) {
        return new JobStatusResponse(snapshot.taskId(), snapshot.sessionId(), snapshot.status(),
                snapshot.createdAt(), snapshot.startedAt(), snapshot.finishedAt(), snapshot.error(),
                snapshot.eventCount());
    }
}

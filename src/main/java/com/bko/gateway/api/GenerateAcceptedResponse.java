package com.bko.gateway.api;

import com.bko.gateway.jobs.JobSnapshot;
import com.bko.gateway.jobs.JobStatus;

public record GenerateAcceptedResponse(
        String taskId,
        String sessionId,
        JobStatus status
) {

    public static GenerateAcceptedResponse from(JobSnapshot snapshot) {
        return new GenerateAcceptedResponse(snapshot.taskId(), snapshot.sessionId(), snapshot.status());
    }
}

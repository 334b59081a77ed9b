package com.bko.gateway.api;

public record CancelJobResponse(
        String status,
        String message
) {
    public static CancelJobResponse success() {
        return new CancelJobResponse("success", "Job cancellation requested.");
    }

    public static CancelJobResponse alreadyFinished() {
        return new CancelJobResponse("finished", "Job has already finished.");
    }
}

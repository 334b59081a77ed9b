package com.bko.gateway.jobs;

import com.bko.gateway.error.GenerationException;

public class JobNotFoundException extends GenerationException {

    private final String taskId;

    public JobNotFoundException(String taskId) {
        super("Job not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

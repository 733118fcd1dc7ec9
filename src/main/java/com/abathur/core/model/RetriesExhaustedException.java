package com.abathur.core.model;

public class RetriesExhaustedException extends TaskQueueException {

    private final String taskId;

    public RetriesExhaustedException(String taskId, int retryCount, int maxRetries) {
        super("Task " + taskId + " has used " + retryCount + " of " + maxRetries + " retries");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

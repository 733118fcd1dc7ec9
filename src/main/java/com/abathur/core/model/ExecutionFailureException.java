package com.abathur.core.model;

/**
 * Raised by agent executors when a run cannot produce a result.
 */
public class ExecutionFailureException extends TaskQueueException {

    private final String taskId;

    public ExecutionFailureException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public ExecutionFailureException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

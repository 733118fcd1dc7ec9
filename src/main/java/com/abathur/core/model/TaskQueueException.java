package com.abathur.core.model;

/**
 * Base class for task queue failures.
 */
public class TaskQueueException extends RuntimeException {
    public TaskQueueException(String message) {
        super(message);
    }

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

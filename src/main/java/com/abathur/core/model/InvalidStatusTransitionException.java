package com.abathur.core.model;

public class InvalidStatusTransitionException extends TaskQueueException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidStatusTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}

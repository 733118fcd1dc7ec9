package com.abathur.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a queued task.
 */
public enum TaskStatus {
    PENDING,
    BLOCKED,
    READY,
    RUNNING,
    AWAITING_CHILDREN,    // spawned subtasks must finish first
    AWAITING_VALIDATION,
    VALIDATION_RUNNING,
    VALIDATION_FAILED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * States whose calculated priority is still worth maintaining.
     */
    public boolean isSchedulable() {
        return this == PENDING || this == BLOCKED || this == READY;
    }

    public Set<TaskStatus> validTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(READY, BLOCKED, CANCELLED);
            case BLOCKED -> EnumSet.of(READY, PENDING, CANCELLED);
            case READY -> EnumSet.of(RUNNING, BLOCKED, PENDING, CANCELLED);
            case RUNNING -> EnumSet.of(AWAITING_CHILDREN, AWAITING_VALIDATION, COMPLETED, FAILED, CANCELLED);
            case AWAITING_CHILDREN -> EnumSet.of(AWAITING_VALIDATION, COMPLETED, FAILED, CANCELLED);
            case AWAITING_VALIDATION -> EnumSet.of(VALIDATION_RUNNING, CANCELLED);
            case VALIDATION_RUNNING -> EnumSet.of(COMPLETED, VALIDATION_FAILED, FAILED, CANCELLED);
            case VALIDATION_FAILED -> EnumSet.of(PENDING, FAILED, CANCELLED);
            case FAILED -> EnumSet.of(PENDING);  // explicit retry only
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return validTransitions().contains(target);
    }
}

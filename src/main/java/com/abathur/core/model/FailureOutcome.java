package com.abathur.core.model;

/**
 * What {@code failTask} did with a failed task.
 *
 * @param task         the task as persisted in {@link TaskStatus#FAILED}
 * @param retryable    true when retries remain; dependents were left untouched
 * @param cancellation cascade over dependents when retries are exhausted, null otherwise
 */
public record FailureOutcome(
    Task task,
    boolean retryable,
    CancellationReport cancellation
) {}

package com.abathur.core.model;

import java.io.Serializable;

/**
 * Outcome of one agent execution. Exactly one is produced per dispatched task.
 *
 * @param taskId    the executed task
 * @param success   true when the agent reported success
 * @param output    captured agent output (nullable)
 * @param error     failure description (nullable on success)
 * @param cancelled true when the execution was stopped by a cancellation request
 * @param elapsedMs wall time spent in the executor
 */
public record ExecutionResult(
    String taskId,
    boolean success,
    String output,
    String error,
    boolean cancelled,
    long elapsedMs
) implements Serializable {

    public static ExecutionResult success(String taskId, String output, long elapsedMs) {
        return new ExecutionResult(taskId, true, output, null, false, elapsedMs);
    }

    public static ExecutionResult failure(String taskId, String error, long elapsedMs) {
        return new ExecutionResult(taskId, false, null, error, false, elapsedMs);
    }

    public static ExecutionResult cancelled(String taskId, long elapsedMs) {
        return new ExecutionResult(taskId, false, null, "Execution cancelled", true, elapsedMs);
    }

    public String outcome() {
        if (cancelled) {
            return "cancelled";
        }
        return success ? "success" : "failure";
    }
}

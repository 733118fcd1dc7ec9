package com.abathur.core.swarm;

import com.abathur.core.model.ExecutionFailureException;
import com.abathur.core.model.ExecutionResult;
import com.abathur.core.model.Task;

/**
 * Runs one task on behalf of the orchestrator. Implementations may block for as long as the
 * agent needs and are called concurrently from several worker threads.
 */
public interface AgentExecutor {

    /**
     * @return exactly one result for the task
     * @throws ExecutionFailureException when the agent could not be run at all
     */
    ExecutionResult execute(Task task);

    /**
     * Best-effort request to stop a running execution. The pending {@link #execute} call
     * still returns, typically with {@link ExecutionResult#cancelled}.
     */
    default void cancel(String taskId) {
    }
}

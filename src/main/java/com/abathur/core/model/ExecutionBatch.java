package com.abathur.core.model;

import java.util.List;

/**
 * One level of an execution plan. Members share a dependency depth and may run in parallel.
 */
public record ExecutionBatch(int level, List<String> taskIds) {
    public ExecutionBatch {
        taskIds = List.copyOf(taskIds);
    }
}

package com.abathur.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time summary of the task queue.
 *
 * @param total               number of stored tasks
 * @param byStatus            count per status, every status present
 * @param averagePriority     mean calculated priority over non-terminal tasks, 0 when none
 * @param maxDependencyDepth  deepest dependency chain over all tasks
 * @param oldestWaiting       earliest submission among pending/blocked tasks (nullable)
 * @param newestSubmission    latest submission over all tasks (nullable)
 */
public record QueueStats(
    int total,
    Map<TaskStatus, Integer> byStatus,
    double averagePriority,
    int maxDependencyDepth,
    Instant oldestWaiting,
    Instant newestSubmission
) {

    public QueueStats {
        byStatus = Map.copyOf(byStatus);
    }

    public int count(TaskStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}

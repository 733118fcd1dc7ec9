package com.abathur.core.model;

import java.util.List;

/**
 * Orchestrator snapshot returned by the control surface.
 *
 * @param availableSlots agent slots not taken by an active execution
 * @param successCount   recorded results that succeeded, since the last reset
 * @param failureCount   recorded results that did not succeed, cancellations included
 */
public record SwarmStatus(
    boolean running,
    int activeCount,
    int availableSlots,
    int completedCount,
    int successCount,
    int failureCount,
    Integer completionLimit,
    int maxConcurrentAgents,
    List<String> activeTaskIds,
    QueueStats queueStats
) {
    public SwarmStatus {
        activeTaskIds = List.copyOf(activeTaskIds);
    }
}

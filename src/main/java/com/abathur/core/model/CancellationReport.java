package com.abathur.core.model;

import java.util.List;
import java.util.Map;

/**
 * Result of a cascading cancellation.
 *
 * @param requestedTaskId the task the cancellation started from
 * @param cancelled       ids moved to {@link TaskStatus#CANCELLED}, root first, in breadth-first order
 * @param unreachable     dependents that could not be cancelled, with the reason
 */
public record CancellationReport(
    String requestedTaskId,
    List<String> cancelled,
    Map<String, String> unreachable
) {
    public CancellationReport {
        cancelled = List.copyOf(cancelled);
        unreachable = Map.copyOf(unreachable);
    }

    public boolean isComplete() {
        return unreachable.isEmpty();
    }
}

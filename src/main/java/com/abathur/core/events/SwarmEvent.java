package com.abathur.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the task queue or the orchestrator.
 *
 * @param eventType event type (e.g. "task.enqueued", "task.completed", "swarm.started")
 * @param taskId    the task this event relates to (nullable for swarm-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwarmEvent(
    String eventType,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_ENQUEUED = "task.enqueued";
    public static final String TASK_READY = "task.ready";
    public static final String TASK_DISPATCHED = "task.dispatched";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_RETRYING = "task.retrying";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String TASK_CANCEL_UNREACHABLE = "task.cancel_unreachable";
    public static final String SWARM_STARTED = "swarm.started";
    public static final String SWARM_STOPPED = "swarm.stopped";
}

package com.abathur.core.model;

/**
 * Thrown when an optimistic write targets a stale version. Callers re-read and retry.
 */
public class VersionConflictException extends TaskQueueException {

    private final String taskId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String taskId, long expectedVersion, long actualVersion) {
        super("Version conflict on task " + taskId + ": expected " + expectedVersion + ", found " + actualVersion);
        this.taskId = taskId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getTaskId() {
        return taskId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}

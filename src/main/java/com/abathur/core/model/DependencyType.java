package com.abathur.core.model;

/**
 * How a task's prerequisites gate its readiness.
 */
public enum DependencyType {
    /** Every prerequisite must be completed. */
    SEQUENTIAL,
    /** At least {@code requiredCompletions} prerequisites must be completed. */
    PARALLEL
}

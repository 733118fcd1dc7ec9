package com.abathur.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Producer-side request to enqueue a task. Only {@code description} is mandatory;
 * a null id is replaced with a generated one.
 */
public record TaskSubmission(
    String id,
    String summary,
    String description,
    String agentType,
    int basePriority,
    List<String> dependencies,
    DependencyType dependencyType,
    Integer requiredCompletions,
    TaskSource source,
    Instant deadline,
    Long estimatedDurationSeconds,
    Integer maxRetries,
    Long maxExecutionTimeoutSeconds,
    String parentTaskId,
    String spawnedByTaskId
) {

    public TaskSubmission {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        dependencyType = dependencyType == null ? DependencyType.SEQUENTIAL : dependencyType;
        source = source == null ? TaskSource.HUMAN : source;
    }

    /**
     * Minimal submission: description, priority and prerequisites, everything else defaulted.
     */
    public static TaskSubmission of(String description, int basePriority, List<String> dependencies) {
        return new TaskSubmission(null, null, description, null, basePriority, dependencies,
                DependencyType.SEQUENTIAL, null, TaskSource.HUMAN, null, null, null, null, null, null);
    }

    public TaskSubmission withId(String newId) {
        return new TaskSubmission(newId, summary, description, agentType, basePriority, dependencies,
                dependencyType, requiredCompletions, source, deadline, estimatedDurationSeconds,
                maxRetries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withSource(TaskSource newSource) {
        return new TaskSubmission(id, summary, description, agentType, basePriority, dependencies,
                dependencyType, requiredCompletions, newSource, deadline, estimatedDurationSeconds,
                maxRetries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withDeadline(Instant newDeadline, Long estimatedSeconds) {
        return new TaskSubmission(id, summary, description, agentType, basePriority, dependencies,
                dependencyType, requiredCompletions, source, newDeadline, estimatedSeconds,
                maxRetries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withParallel(int required) {
        return new TaskSubmission(id, summary, description, agentType, basePriority, dependencies,
                DependencyType.PARALLEL, required, source, deadline, estimatedDurationSeconds,
                maxRetries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withMaxRetries(int retries) {
        return new TaskSubmission(id, summary, description, agentType, basePriority, dependencies,
                dependencyType, requiredCompletions, source, deadline, estimatedDurationSeconds,
                retries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withExecutionTimeout(long seconds) {
        return new TaskSubmission(id, summary, description, agentType, basePriority, dependencies,
                dependencyType, requiredCompletions, source, deadline, estimatedDurationSeconds,
                maxRetries, seconds, parentTaskId, spawnedByTaskId);
    }

    public TaskSubmission withAgentType(String type) {
        return new TaskSubmission(id, summary, description, type, basePriority, dependencies,
                dependencyType, requiredCompletions, source, deadline, estimatedDurationSeconds,
                maxRetries, maxExecutionTimeoutSeconds, parentTaskId, spawnedByTaskId);
    }
}

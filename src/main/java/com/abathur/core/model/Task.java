package com.abathur.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A unit of schedulable work held in the task store.
 *
 * @param id                         unique identifier, never changes
 * @param summary                    short human-readable label
 * @param description                full instruction handed to the agent
 * @param agentType                  kind of agent expected to run the task
 * @param status                     current lifecycle state
 * @param basePriority               caller-supplied intent, 0-10
 * @param calculatedPriority         derived score, 0-100; written only by the priority calculator
 * @param dependencies               ids of prerequisite tasks, in declaration order
 * @param dependencyType             how prerequisites gate readiness
 * @param requiredCompletions        completed prerequisites needed for {@link DependencyType#PARALLEL}; null otherwise
 * @param source                     provenance used in scoring
 * @param deadline                   optional due time
 * @param estimatedDurationSeconds   optional expected run time
 * @param maxExecutionTimeoutSeconds run time after which a running task is treated as stale
 * @param retryCount                 retries consumed so far
 * @param maxRetries                 retries allowed before the task fails terminally
 * @param errorMessage               last failure reported for the task
 * @param parentTaskId               hierarchical parent, if any
 * @param spawnedByTaskId            task whose execution created this one, if any
 * @param dependencyDepth            longest prerequisite chain below this task
 * @param submittedAt                enqueue time, used as the priority tie-break
 * @param startedAt                  last dispatch time
 * @param completedAt                time a terminal state was reached
 * @param version                    optimistic-concurrency stamp, incremented on every write
 */
public record Task(
    String id,
    String summary,
    String description,
    String agentType,
    TaskStatus status,
    int basePriority,
    double calculatedPriority,
    List<String> dependencies,
    DependencyType dependencyType,
    Integer requiredCompletions,
    TaskSource source,
    Instant deadline,
    Long estimatedDurationSeconds,
    long maxExecutionTimeoutSeconds,
    int retryCount,
    int maxRetries,
    String errorMessage,
    String parentTaskId,
    String spawnedByTaskId,
    int dependencyDepth,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    long version
) implements Serializable {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_EXECUTION_TIMEOUT_SECONDS = 3600;

    /** Dispatch order: calculated priority descending, then submission time ascending, then id. */
    public static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparingDouble(Task::calculatedPriority).reversed()
            .thenComparing(Task::submittedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Task::id);

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        dependencyType = dependencyType == null ? DependencyType.SEQUENTIAL : dependencyType;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canRetry() {
        return status == TaskStatus.FAILED && retryCount < maxRetries;
    }

    /**
     * Number of completed prerequisites this task needs before it may run.
     */
    public int completionsNeeded() {
        if (dependencyType == DependencyType.PARALLEL && requiredCompletions != null) {
            return requiredCompletions;
        }
        return dependencies.size();
    }

    /**
     * Copy carrying a new status and the matching timestamps. Does not validate the transition.
     */
    public Task withStatus(TaskStatus newStatus, Instant now) {
        var builder = toBuilder().status(newStatus);
        if (newStatus == TaskStatus.RUNNING) {
            builder.startedAt(now);
        }
        if (newStatus.isTerminal()) {
            builder.completedAt(now);
        }
        return builder.build();
    }

    public Task withCalculatedPriority(double priority) {
        return toBuilder().calculatedPriority(priority).build();
    }

    public Task withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String summary;
        private String description;
        private String agentType;
        private TaskStatus status = TaskStatus.PENDING;
        private int basePriority = 5;
        private double calculatedPriority;
        private List<String> dependencies = List.of();
        private DependencyType dependencyType = DependencyType.SEQUENTIAL;
        private Integer requiredCompletions;
        private TaskSource source = TaskSource.HUMAN;
        private Instant deadline;
        private Long estimatedDurationSeconds;
        private long maxExecutionTimeoutSeconds = DEFAULT_EXECUTION_TIMEOUT_SECONDS;
        private int retryCount;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private String errorMessage;
        private String parentTaskId;
        private String spawnedByTaskId;
        private int dependencyDepth;
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private long version;

        private Builder(String id) {
            this.id = id;
        }

        private Builder(Task t) {
            this.id = t.id;
            this.summary = t.summary;
            this.description = t.description;
            this.agentType = t.agentType;
            this.status = t.status;
            this.basePriority = t.basePriority;
            this.calculatedPriority = t.calculatedPriority;
            this.dependencies = t.dependencies;
            this.dependencyType = t.dependencyType;
            this.requiredCompletions = t.requiredCompletions;
            this.source = t.source;
            this.deadline = t.deadline;
            this.estimatedDurationSeconds = t.estimatedDurationSeconds;
            this.maxExecutionTimeoutSeconds = t.maxExecutionTimeoutSeconds;
            this.retryCount = t.retryCount;
            this.maxRetries = t.maxRetries;
            this.errorMessage = t.errorMessage;
            this.parentTaskId = t.parentTaskId;
            this.spawnedByTaskId = t.spawnedByTaskId;
            this.dependencyDepth = t.dependencyDepth;
            this.submittedAt = t.submittedAt;
            this.startedAt = t.startedAt;
            this.completedAt = t.completedAt;
            this.version = t.version;
        }

        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder agentType(String agentType) { this.agentType = agentType; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder basePriority(int basePriority) { this.basePriority = basePriority; return this; }
        public Builder calculatedPriority(double calculatedPriority) { this.calculatedPriority = calculatedPriority; return this; }
        public Builder dependencies(List<String> dependencies) { this.dependencies = dependencies; return this; }
        public Builder dependencyType(DependencyType dependencyType) { this.dependencyType = dependencyType; return this; }
        public Builder requiredCompletions(Integer requiredCompletions) { this.requiredCompletions = requiredCompletions; return this; }
        public Builder source(TaskSource source) { this.source = source; return this; }
        public Builder deadline(Instant deadline) { this.deadline = deadline; return this; }
        public Builder estimatedDurationSeconds(Long seconds) { this.estimatedDurationSeconds = seconds; return this; }
        public Builder maxExecutionTimeoutSeconds(long seconds) { this.maxExecutionTimeoutSeconds = seconds; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder parentTaskId(String parentTaskId) { this.parentTaskId = parentTaskId; return this; }
        public Builder spawnedByTaskId(String spawnedByTaskId) { this.spawnedByTaskId = spawnedByTaskId; return this; }
        public Builder dependencyDepth(int dependencyDepth) { this.dependencyDepth = dependencyDepth; return this; }
        public Builder submittedAt(Instant submittedAt) { this.submittedAt = submittedAt; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder version(long version) { this.version = version; return this; }

        public Task build() {
            return new Task(id, summary, description, agentType, status, basePriority, calculatedPriority,
                    dependencies, dependencyType, requiredCompletions, source, deadline,
                    estimatedDurationSeconds, maxExecutionTimeoutSeconds, retryCount, maxRetries,
                    errorMessage, parentTaskId, spawnedByTaskId, dependencyDepth,
                    submittedAt, startedAt, completedAt, version);
        }
    }
}

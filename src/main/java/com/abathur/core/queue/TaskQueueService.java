package com.abathur.core.queue;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.dependency.DependencyResolver;
import com.abathur.core.events.EventBus;
import com.abathur.core.events.SwarmEvent;
import com.abathur.core.metrics.AbathurMetrics;
import com.abathur.core.model.CancellationReport;
import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.DependencyType;
import com.abathur.core.model.ExecutionBatch;
import com.abathur.core.model.FailureOutcome;
import com.abathur.core.model.InvalidStatusTransitionException;
import com.abathur.core.model.QueueStats;
import com.abathur.core.model.RetriesExhaustedException;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskQueueException;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.TaskSubmission;
import com.abathur.core.model.VersionConflictException;
import com.abathur.core.priority.PriorityCalculator;
import com.abathur.core.store.OptimisticWrites;
import com.abathur.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Producer-facing task queue: admission, dispatch claims, completion, failure, retry and
 * cascading cancellation.
 * <p>
 * Every state change goes through the {@link TaskStore} with a version check and bounded
 * retry, invalidates the {@link DependencyResolver} cache, and refreshes the priorities
 * whose inputs changed.
 */
@Service
public class TaskQueueService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueService.class);

    static final int MAX_SUMMARY_LENGTH = 100;
    private static final Set<TaskStatus> WAITING = EnumSet.of(TaskStatus.PENDING, TaskStatus.BLOCKED);

    private final TaskStore store;
    private final DependencyResolver resolver;
    private final PriorityCalculator calculator;
    private final Clock clock;
    private final int maxWriteAttempts;
    private final EventBus eventBus;
    private final AbathurMetrics metrics;

    @Autowired
    public TaskQueueService(TaskStore store, DependencyResolver resolver, PriorityCalculator calculator,
                            Clock clock, AbathurProperties properties,
                            @Autowired(required = false) EventBus eventBus,
                            @Autowired(required = false) AbathurMetrics metrics) {
        this(store, resolver, calculator, clock, properties.getStore().getMaxWriteAttempts(), eventBus, metrics);
    }

    public TaskQueueService(TaskStore store, DependencyResolver resolver, PriorityCalculator calculator,
                            Clock clock, int maxWriteAttempts, EventBus eventBus, AbathurMetrics metrics) {
        this.store = store;
        this.resolver = resolver;
        this.calculator = calculator;
        this.clock = clock;
        this.maxWriteAttempts = maxWriteAttempts;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // ── Admission ─────────────────────────────────────────────────────────

    /**
     * Validates and stores a new task, {@code READY} when its prerequisites are already
     * satisfied and {@code BLOCKED} otherwise, with depth and priority filled in.
     *
     * @throws IllegalArgumentException    on an out-of-range priority, a missing description,
     *                                     a negative retry budget, a non-positive execution
     *                                     timeout or an invalid parallel threshold
     * @throws TaskNotFoundException       when a prerequisite does not exist
     * @throws CircularDependencyException when the task lists itself as a prerequisite
     */
    public Task enqueue(TaskSubmission submission) {
        if (submission.description() == null || submission.description().isBlank()) {
            throw new IllegalArgumentException("Task description must not be empty");
        }
        if (submission.basePriority() < 0 || submission.basePriority() > 10) {
            throw new IllegalArgumentException("Base priority must be between 0 and 10, got " + submission.basePriority());
        }
        if (submission.maxRetries() != null && submission.maxRetries() < 0) {
            throw new IllegalArgumentException("Max retries must not be negative, got " + submission.maxRetries());
        }
        if (submission.maxExecutionTimeoutSeconds() != null && submission.maxExecutionTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException(
                    "Execution timeout must be positive, got " + submission.maxExecutionTimeoutSeconds());
        }
        String id = submission.id() != null ? submission.id() : UUID.randomUUID().toString();
        List<String> dependencies = List.copyOf(new LinkedHashSet<>(submission.dependencies()));
        Integer requiredCompletions = validateThreshold(submission, dependencies.size());

        for (String dep : dependencies) {
            if (dep.equals(id)) {
                throw new CircularDependencyException("Task cannot depend on itself", List.of(id, id));
            }
            store.requireTask(dep);
            resolver.validateNewDependency(id, dep);
        }

        Task candidate = Task.builder(id)
                .summary(summarize(submission))
                .description(submission.description())
                .agentType(submission.agentType())
                .basePriority(submission.basePriority())
                .dependencies(dependencies)
                .dependencyType(submission.dependencyType())
                .requiredCompletions(requiredCompletions)
                .source(submission.source())
                .deadline(submission.deadline())
                .estimatedDurationSeconds(submission.estimatedDurationSeconds())
                .maxRetries(submission.maxRetries() != null ? submission.maxRetries() : Task.DEFAULT_MAX_RETRIES)
                .maxExecutionTimeoutSeconds(submission.maxExecutionTimeoutSeconds() != null
                        ? submission.maxExecutionTimeoutSeconds() : Task.DEFAULT_EXECUTION_TIMEOUT_SECONDS)
                .parentTaskId(submission.parentTaskId())
                .spawnedByTaskId(submission.spawnedByTaskId())
                .submittedAt(clock.instant())
                .build();
        TaskStatus initial = resolver.areDependenciesMet(candidate) ? TaskStatus.READY : TaskStatus.BLOCKED;

        store.insertTask(candidate.toBuilder().status(initial).build());
        resolver.invalidateCache();

        Task stored = OptimisticWrites.update(store, id, maxWriteAttempts, t -> t.toBuilder()
                .dependencyDepth(resolver.calculateDependencyDepth(id))
                .calculatedPriority(calculator.calculatePriority(t))
                .build());
        if (!dependencies.isEmpty()) {
            calculator.recalculatePriorities(dependencies);
        }

        log.info("Enqueued task {} as {} (priority {}, depth {})",
                id, initial, String.format("%.2f", stored.calculatedPriority()), stored.dependencyDepth());
        publish(SwarmEvent.TASK_ENQUEUED, id, Map.of(
                "status", initial.name(),
                "priority", stored.calculatedPriority()));
        if (initial == TaskStatus.READY) {
            publish(SwarmEvent.TASK_READY, id, Map.of());
        }
        return stored;
    }

    /**
     * Adds a prerequisite to a waiting or ready task, re-gating and re-scoring it.
     *
     * @throws CircularDependencyException when the edge would close a cycle; nothing is written
     */
    public Task addDependency(String taskId, String dependencyId) {
        Task task = store.requireTask(taskId);
        store.requireTask(dependencyId);
        if (!task.status().isSchedulable()) {
            throw new TaskQueueException("Cannot add a dependency to task " + taskId + " in status " + task.status());
        }
        resolver.validateNewDependency(taskId, dependencyId);
        store.insertDependency(taskId, dependencyId);
        resolver.invalidateCache();

        Task updated = OptimisticWrites.update(store, taskId, maxWriteAttempts, t -> {
            boolean met = resolver.areDependenciesMet(t);
            if (t.status() == TaskStatus.READY && !met) {
                return t.withStatus(TaskStatus.BLOCKED, clock.instant());
            }
            if (WAITING.contains(t.status()) && met) {
                return t.withStatus(TaskStatus.READY, clock.instant());
            }
            return null;
        });

        List<String> affected = new ArrayList<>();
        affected.add(taskId);
        affected.addAll(resolver.transitiveDependents(taskId));
        refreshDepths(affected);
        affected.add(dependencyId);
        calculator.recalculatePriorities(affected);

        log.info("Task {} now depends on {} (status {})", taskId, dependencyId, updated.status());
        if (updated.status() == TaskStatus.READY && task.status() != TaskStatus.READY) {
            publish(SwarmEvent.TASK_READY, taskId, Map.of());
        }
        return store.requireTask(taskId);
    }

    // ── Dispatch ──────────────────────────────────────────────────────────

    /**
     * Claims the highest-priority ready task by moving it to {@code RUNNING}. A claim lost
     * to a concurrent caller moves on to the next candidate.
     */
    public Optional<Task> dequeueNextTask() {
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            Optional<Task> next = store.getNextReadyTask();
            if (next.isEmpty()) {
                return Optional.empty();
            }
            Task candidate = next.get();
            try {
                Task claimed = store.updateStatus(candidate.id(), TaskStatus.RUNNING, candidate.version());
                publish(SwarmEvent.TASK_DISPATCHED, claimed.id(), Map.of("priority", claimed.calculatedPriority()));
                return Optional.of(claimed);
            } catch (VersionConflictException | InvalidStatusTransitionException e) {
                log.debug("Lost claim on task {} (attempt {}): {}", candidate.id(), attempt, e.getMessage());
            }
        }
        log.warn("Could not claim a ready task after {} attempts", maxWriteAttempts);
        return Optional.empty();
    }

    // ── Outcomes ──────────────────────────────────────────────────────────

    /**
     * Marks a task completed and promotes the dependents it was holding back.
     *
     * @return ids of dependents that became {@code READY}
     */
    public List<String> completeTask(String taskId) {
        Task completed = transition(taskId, TaskStatus.COMPLETED, null);
        resolver.invalidateCache();

        List<String> promoted = promoteReadyDependents(taskId);
        List<String> rescore = new ArrayList<>(resolver.getBlockedTasks(taskId));
        rescore.addAll(completed.dependencies());
        calculator.recalculatePriorities(rescore);

        log.info("Task {} completed; {} dependent(s) now ready", taskId, promoted.size());
        publish(SwarmEvent.TASK_COMPLETED, taskId, Map.of("promoted", promoted));
        promoted.forEach(id -> publish(SwarmEvent.TASK_READY, id, Map.of("unblockedBy", taskId)));
        return promoted;
    }

    /**
     * Marks a task failed with {@code error}. When retries remain the dependents are left
     * waiting; otherwise every transitive dependent is cancelled.
     */
    public FailureOutcome failTask(String taskId, String error) {
        Task failed = transition(taskId, TaskStatus.FAILED, error);
        resolver.invalidateCache();
        calculator.recalculatePriorities(failed.dependencies());

        publish(SwarmEvent.TASK_FAILED, taskId, Map.of(
                "error", error == null ? "" : error,
                "retryCount", failed.retryCount(),
                "maxRetries", failed.maxRetries()));

        if (failed.canRetry()) {
            log.info("Task {} failed (retry {}/{} available): {}",
                    taskId, failed.retryCount() + 1, failed.maxRetries(), error);
            return new FailureOutcome(failed, true, null);
        }
        log.warn("Task {} failed permanently after {} retries: {}", taskId, failed.retryCount(), error);
        CancellationReport report = cascadeCancel(taskId, false,
                "Prerequisite " + taskId + " failed");
        return new FailureOutcome(failed, false, report);
    }

    /**
     * Returns a failed task to the queue, consuming one retry.
     *
     * @throws RetriesExhaustedException        when no retries remain
     * @throws InvalidStatusTransitionException when the task is not {@code FAILED}
     */
    public Task retryTask(String taskId) {
        Task retried = OptimisticWrites.update(store, taskId, maxWriteAttempts, t -> {
            if (t.status() != TaskStatus.FAILED) {
                throw new InvalidStatusTransitionException(taskId, t.status(), TaskStatus.PENDING);
            }
            if (t.retryCount() >= t.maxRetries()) {
                throw new RetriesExhaustedException(taskId, t.retryCount(), t.maxRetries());
            }
            return t.toBuilder()
                    .status(TaskStatus.PENDING)
                    .retryCount(t.retryCount() + 1)
                    .startedAt(null)
                    .completedAt(null)
                    .build();
        });
        resolver.invalidateCache();

        Task resolved = OptimisticWrites.update(store, taskId, maxWriteAttempts, t -> {
            if (t.status() != TaskStatus.PENDING) {
                return null;
            }
            TaskStatus next = resolver.areDependenciesMet(t) ? TaskStatus.READY : TaskStatus.BLOCKED;
            return t.withStatus(next, clock.instant());
        });

        List<String> rescore = new ArrayList<>();
        rescore.add(taskId);
        rescore.addAll(resolved.dependencies());
        calculator.recalculatePriorities(rescore);

        if (metrics != null) {
            metrics.recordRetry();
        }
        log.info("Retrying task {} (retry {}/{}), now {}",
                taskId, retried.retryCount(), retried.maxRetries(), resolved.status());
        publish(SwarmEvent.TASK_RETRYING, taskId, Map.of("retryCount", retried.retryCount()));
        if (resolved.status() == TaskStatus.READY) {
            publish(SwarmEvent.TASK_READY, taskId, Map.of());
        }
        return store.requireTask(taskId);
    }

    /**
     * Cancels a task and every transitive dependent. Cancelling an already cancelled task
     * is a no-op.
     *
     * @throws InvalidStatusTransitionException when the task is completed or failed
     */
    public CancellationReport cancelTask(String taskId) {
        Task task = store.requireTask(taskId);
        if (task.status() == TaskStatus.CANCELLED) {
            return new CancellationReport(taskId, List.of(), Map.of());
        }
        if (!task.status().canTransitionTo(TaskStatus.CANCELLED)) {
            throw new InvalidStatusTransitionException(taskId, task.status(), TaskStatus.CANCELLED);
        }
        return cascadeCancel(taskId, true, "Prerequisite " + taskId + " was cancelled");
    }

    // ── Maintenance ───────────────────────────────────────────────────────

    /**
     * Promotes every pending or blocked task whose prerequisites are met, and parks pending
     * tasks whose prerequisites are not.
     *
     * @return ids promoted to {@code READY}
     */
    public List<String> resolveReadiness() {
        resolver.invalidateCache();
        List<String> promoted = new ArrayList<>();
        for (Task task : store.listTasks(WAITING)) {
            try {
                Task updated = OptimisticWrites.update(store, task.id(), maxWriteAttempts, t -> {
                    if (!WAITING.contains(t.status())) {
                        return null;
                    }
                    boolean met = resolver.areDependenciesMet(t);
                    if (met) {
                        return t.withStatus(TaskStatus.READY, clock.instant());
                    }
                    return t.status() == TaskStatus.PENDING ? t.withStatus(TaskStatus.BLOCKED, clock.instant()) : null;
                });
                if (updated.status() == TaskStatus.READY) {
                    promoted.add(updated.id());
                }
            } catch (TaskQueueException e) {
                log.warn("Skipping readiness check for task {}: {}", task.id(), e.getMessage());
            }
        }
        calculator.recalculatePriorities(promoted);
        promoted.forEach(id -> publish(SwarmEvent.TASK_READY, id, Map.of()));
        log.info("Readiness pass promoted {} task(s)", promoted.size());
        return promoted;
    }

    /**
     * Fails running tasks whose {@code startedAt + maxExecutionTimeout + buffer} has passed,
     * retrying those with retries left.
     *
     * @param excluded ids still tracked by a live execution
     * @return ids of the recovered tasks
     */
    public List<String> recoverStaleTasks(Set<String> excluded, Duration buffer) {
        Instant now = clock.instant();
        List<String> recovered = new ArrayList<>();
        for (Task task : store.listTasks(EnumSet.of(TaskStatus.RUNNING))) {
            if (excluded.contains(task.id()) || task.startedAt() == null) {
                continue;
            }
            Instant staleAt = task.startedAt()
                    .plusSeconds(task.maxExecutionTimeoutSeconds())
                    .plus(buffer);
            if (!now.isAfter(staleAt)) {
                continue;
            }
            try {
                FailureOutcome outcome = failTask(task.id(), "Execution timed out after "
                        + task.maxExecutionTimeoutSeconds() + "s without a result");
                if (outcome.retryable()) {
                    retryTask(task.id());
                }
                recovered.add(task.id());
            } catch (TaskQueueException e) {
                log.warn("Could not recover stale task {}: {}", task.id(), e.getMessage());
            }
        }
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} stale running task(s): {}", recovered.size(), recovered);
            if (metrics != null) {
                metrics.recordStaleRecovery(recovered.size());
            }
        }
        return recovered;
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public Task getTask(String taskId) {
        return store.requireTask(taskId);
    }

    public List<Task> listTasks(Set<TaskStatus> statuses, int limit) {
        return store.listTasks(statuses, limit);
    }

    public QueueStats queueStats() {
        List<Task> all = store.listTasks(Set.of());
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            byStatus.put(status, 0);
        }
        double prioritySum = 0;
        int active = 0;
        int maxDepth = 0;
        Instant oldestWaiting = null;
        Instant newest = null;
        for (Task t : all) {
            byStatus.merge(t.status(), 1, Integer::sum);
            if (!t.isTerminal()) {
                prioritySum += t.calculatedPriority();
                active++;
            }
            maxDepth = Math.max(maxDepth, t.dependencyDepth());
            if (WAITING.contains(t.status()) && t.submittedAt() != null
                    && (oldestWaiting == null || t.submittedAt().isBefore(oldestWaiting))) {
                oldestWaiting = t.submittedAt();
            }
            if (t.submittedAt() != null && (newest == null || t.submittedAt().isAfter(newest))) {
                newest = t.submittedAt();
            }
        }
        return new QueueStats(all.size(), byStatus, active == 0 ? 0.0 : prioritySum / active,
                maxDepth, oldestWaiting, newest);
    }

    /**
     * Parallel batches for {@code taskIds}, or for every non-terminal task when empty.
     */
    public List<ExecutionBatch> executionPlan(Collection<String> taskIds) {
        Collection<String> ids = taskIds;
        if (ids == null || ids.isEmpty()) {
            ids = store.listTasks(Set.of()).stream()
                    .filter(t -> !t.isTerminal())
                    .map(Task::id)
                    .toList();
        }
        return resolver.executionPlan(ids);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Task transition(String taskId, TaskStatus target, String error) {
        return OptimisticWrites.update(store, taskId, maxWriteAttempts, t -> {
            if (!t.status().canTransitionTo(target)) {
                throw new InvalidStatusTransitionException(taskId, t.status(), target);
            }
            Task moved = t.withStatus(target, clock.instant());
            return error == null ? moved : moved.toBuilder().errorMessage(error).build();
        });
    }

    private List<String> promoteReadyDependents(String taskId) {
        List<String> promoted = new ArrayList<>();
        for (String dependentId : store.findDependents(taskId)) {
            boolean[] promotedNow = {false};
            try {
                OptimisticWrites.update(store, dependentId, maxWriteAttempts, t -> {
                    promotedNow[0] = WAITING.contains(t.status()) && resolver.areDependenciesMet(t);
                    return promotedNow[0] ? t.withStatus(TaskStatus.READY, clock.instant()) : null;
                });
                if (promotedNow[0]) {
                    promoted.add(dependentId);
                }
            } catch (TaskQueueException e) {
                log.warn("Could not promote dependent {} of {}: {}", dependentId, taskId, e.getMessage());
            }
        }
        return promoted;
    }

    private CancellationReport cascadeCancel(String rootId, boolean includeRoot, String reason) {
        List<String> cancelled = new ArrayList<>();
        Map<String, String> unreachable = new LinkedHashMap<>();

        if (includeRoot) {
            tryCancel(rootId, "Cancelled", cancelled, unreachable);
        }

        Set<String> visited = new HashSet<>();
        visited.add(rootId);
        Deque<String> queue = new ArrayDeque<>(store.findDependents(rootId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            Optional<Task> task = store.getTask(id);
            if (task.isEmpty()) {
                unreachable.put(id, "task row missing");
                continue;
            }
            if (task.get().isTerminal()) {
                continue;
            }
            tryCancel(id, reason, cancelled, unreachable);
            queue.addAll(store.findDependents(id));
        }

        resolver.invalidateCache();
        Set<String> rescore = new LinkedHashSet<>();
        store.getTask(rootId).ifPresent(root -> rescore.addAll(root.dependencies()));
        for (String id : cancelled) {
            store.getTask(id).ifPresent(t -> rescore.addAll(t.dependencies()));
        }
        rescore.removeAll(cancelled);
        if (!rescore.isEmpty()) {
            calculator.recalculatePriorities(rescore);
        }

        if (metrics != null) {
            metrics.recordCascadeCancellation(cancelled.size());
        }
        for (String id : cancelled) {
            publish(SwarmEvent.TASK_CANCELLED, id, Map.of("cause", rootId));
        }
        unreachable.forEach((id, why) -> {
            log.warn("Cascade from {} could not cancel {}: {}", rootId, id, why);
            publish(SwarmEvent.TASK_CANCEL_UNREACHABLE, id, Map.of("cause", rootId, "reason", why));
        });
        log.info("Cancelled {} task(s) starting from {}", cancelled.size(), rootId);
        return new CancellationReport(rootId, cancelled, unreachable);
    }

    private void tryCancel(String id, String reason, List<String> cancelled, Map<String, String> unreachable) {
        try {
            Task result = OptimisticWrites.update(store, id, maxWriteAttempts, t -> {
                if (t.isTerminal()) {
                    return null;
                }
                if (!t.status().canTransitionTo(TaskStatus.CANCELLED)) {
                    throw new InvalidStatusTransitionException(id, t.status(), TaskStatus.CANCELLED);
                }
                return t.withStatus(TaskStatus.CANCELLED, clock.instant()).toBuilder().errorMessage(reason).build();
            });
            if (result.status() == TaskStatus.CANCELLED) {
                cancelled.add(id);
            }
        } catch (VersionConflictException e) {
            unreachable.put(id, "version conflict persisted after " + maxWriteAttempts + " attempts");
        } catch (TaskQueueException e) {
            unreachable.put(id, e.getMessage());
        }
    }

    private void refreshDepths(Collection<String> ids) {
        for (String id : ids) {
            try {
                OptimisticWrites.update(store, id, maxWriteAttempts, t -> {
                    int depth = resolver.calculateDependencyDepth(id);
                    return depth == t.dependencyDepth() ? null : t.toBuilder().dependencyDepth(depth).build();
                });
            } catch (TaskQueueException e) {
                log.warn("Could not refresh depth of task {}: {}", id, e.getMessage());
            }
        }
    }

    private static Integer validateThreshold(TaskSubmission submission, int dependencyCount) {
        if (submission.dependencyType() != DependencyType.PARALLEL) {
            return null;
        }
        Integer required = submission.requiredCompletions();
        if (required == null || required < 1 || required > dependencyCount) {
            throw new IllegalArgumentException("Parallel dependencies need requiredCompletions between 1 and "
                    + dependencyCount + ", got " + required);
        }
        return required;
    }

    private static String summarize(TaskSubmission submission) {
        if (submission.summary() != null && !submission.summary().isBlank()) {
            return submission.summary().strip();
        }
        String text = submission.description().strip();
        return text.length() <= MAX_SUMMARY_LENGTH ? text : text.substring(0, MAX_SUMMARY_LENGTH);
    }

    private void publish(String eventType, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new SwarmEvent(eventType, taskId, payload, clock.instant()));
        }
    }
}

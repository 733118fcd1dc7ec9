package com.abathur.core.priority;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.dependency.DependencyResolver;
import com.abathur.core.metrics.AbathurMetrics;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskSource;
import com.abathur.core.store.OptimisticWrites;
import com.abathur.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores tasks for dispatch order.
 * <p>
 * Five sub-scores, each on a 0-100 scale, are combined with {@link PriorityWeights} and
 * clamped to [0, 100]:
 * <ul>
 *   <li>base: {@code basePriority * 10}</li>
 *   <li>depth: {@code min(100, depth * 10)}</li>
 *   <li>urgency: stepped by time left before the deadline</li>
 *   <li>blocking: bucketed count of non-terminal dependents</li>
 *   <li>source: human requests first, implementation follow-ups last</li>
 * </ul>
 * Holds no mutable state of its own and is safe to call concurrently.
 */
@Service
public class PriorityCalculator {

    private static final Logger log = LoggerFactory.getLogger(PriorityCalculator.class);

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    private static final Duration ONE_HOUR = Duration.ofHours(1);
    private static final Duration ONE_DAY = Duration.ofDays(1);
    private static final Duration ONE_WEEK = Duration.ofDays(7);

    private final DependencyResolver resolver;
    private final TaskStore store;
    private final PriorityWeights weights;
    private final Clock clock;
    private final int maxWriteAttempts;
    private final AbathurMetrics metrics;

    @Autowired
    public PriorityCalculator(DependencyResolver resolver, TaskStore store, AbathurProperties properties,
                              Clock clock, @Autowired(required = false) AbathurMetrics metrics) {
        this(resolver, store, PriorityWeights.from(properties.getPriority()), clock,
                properties.getStore().getMaxWriteAttempts(), metrics);
    }

    public PriorityCalculator(DependencyResolver resolver, TaskStore store, PriorityWeights weights,
                              Clock clock, int maxWriteAttempts, AbathurMetrics metrics) {
        this.resolver = resolver;
        this.store = store;
        this.weights = weights;
        this.clock = clock;
        this.maxWriteAttempts = maxWriteAttempts;
        this.metrics = metrics;
    }

    /**
     * Priority of a stored task at the current instant. Resolver errors propagate.
     */
    public double calculatePriority(Task task) {
        int depth = resolver.calculateDependencyDepth(task.id());
        int blocked = resolver.getBlockedTasks(task.id()).size();
        double score = weights.base() * baseScore(task.basePriority())
                + weights.depth() * depthScore(depth)
                + weights.urgency() * urgencyScore(task.deadline(), task.estimatedDurationSeconds(), clock.instant())
                + weights.blocking() * blockingScore(blocked)
                + weights.source() * sourceScore(task.source());
        return clamp(score);
    }

    /**
     * Recomputes and persists one task's priority. Errors propagate to the caller.
     *
     * @return the stored task, unchanged when it is running or terminal
     */
    public Task recalculate(String taskId) {
        return OptimisticWrites.update(store, taskId, maxWriteAttempts, current -> {
            if (!current.status().isSchedulable()) {
                return null;
            }
            return current.withCalculatedPriority(calculatePriority(current));
        });
    }

    /**
     * Batch form of {@link #recalculate}. Tasks that are not pending, blocked or ready are
     * skipped; a task that cannot be loaded or scored is logged and skipped.
     *
     * @return new priority per recalculated task id
     */
    public Map<String, Double> recalculatePriorities(Collection<String> taskIds) {
        Map<String, Double> results = new LinkedHashMap<>();
        for (String id : taskIds) {
            try {
                Task stored = recalculate(id);
                if (stored.status().isSchedulable()) {
                    results.put(id, stored.calculatedPriority());
                }
            } catch (RuntimeException e) {
                log.warn("Skipping priority recalculation for task {}: {}", id, e.getMessage());
            }
        }
        if (metrics != null && !results.isEmpty()) {
            metrics.recordPriorityRecalculation(results.size());
        }
        log.debug("Recalculated priorities for {} of {} tasks", results.size(), taskIds.size());
        return results;
    }

    // ── Sub-scores ────────────────────────────────────────────────────────

    static double baseScore(int basePriority) {
        return basePriority * 10.0;
    }

    static double depthScore(int depth) {
        return Math.min(100.0, depth * 10.0);
    }

    static double urgencyScore(Instant deadline, Long estimatedDurationSeconds, Instant now) {
        if (deadline == null) {
            return 0.0;
        }
        Duration remaining = Duration.between(now, deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return 100.0;
        }
        if (estimatedDurationSeconds != null && remaining.compareTo(Duration.ofSeconds(estimatedDurationSeconds)) < 0) {
            return 100.0;
        }
        if (remaining.compareTo(ONE_MINUTE) < 0) {
            return 100.0;
        }
        if (remaining.compareTo(ONE_HOUR) < 0) {
            return 80.0;
        }
        if (remaining.compareTo(ONE_DAY) < 0) {
            return 50.0;
        }
        if (remaining.compareTo(ONE_WEEK) < 0) {
            return 30.0;
        }
        return 10.0;
    }

    static double blockingScore(int blockedCount) {
        if (blockedCount <= 0) {
            return 0.0;
        }
        if (blockedCount <= 2) {
            return 20.0;
        }
        if (blockedCount <= 5) {
            return 40.0;
        }
        if (blockedCount <= 10) {
            return 60.0;
        }
        if (blockedCount <= 20) {
            return 80.0;
        }
        return 100.0;
    }

    static double sourceScore(TaskSource source) {
        if (source == null) {
            return 0.0;
        }
        return switch (source) {
            case HUMAN -> 100.0;
            case AGENT_REQUIREMENTS -> 75.0;
            case AGENT_PLANNER -> 50.0;
            case AGENT_IMPLEMENTATION -> 25.0;
        };
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }
}

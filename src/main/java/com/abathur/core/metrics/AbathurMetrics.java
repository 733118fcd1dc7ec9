package com.abathur.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task scheduling and swarm execution.
 */
@Service
public class AbathurMetrics {

    private final MeterRegistry registry;

    public AbathurMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agentType, long ms) {
        Timer.builder("abathur.task.duration")
                .tag("agent", agentType == null ? "default" : agentType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "success", "failure" or "cancelled"
     */
    public void recordExecutionOutcome(String outcome) {
        Counter.builder("abathur.task.executions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCascadeCancellation(int cancelledCount) {
        Counter.builder("abathur.task.cascade_cancellations")
                .description("Cascading cancellations started")
                .register(registry)
                .increment();

        DistributionSummary.builder("abathur.task.cascade_size")
                .description("Tasks cancelled per cascade")
                .register(registry)
                .record(cancelledCount);
    }

    public void recordPriorityRecalculation(int taskCount) {
        Counter.builder("abathur.priority.recalculations")
                .register(registry)
                .increment(taskCount);
    }

    public void recordRetry() {
        Counter.builder("abathur.task.retries")
                .register(registry)
                .increment();
    }

    public void recordStaleRecovery(int count) {
        Counter.builder("abathur.task.stale_recoveries")
                .description("Running tasks failed after exceeding their execution timeout")
                .register(registry)
                .increment(count);
    }
}

package com.abathur.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AbathurMetricsTest {

    private SimpleMeterRegistry registry;
    private AbathurMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AbathurMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskExecution records by agent tag")
    void recordTaskExecution() {
        metrics.recordTaskExecution("coder", 200);
        metrics.recordTaskExecution("coder", 300);
        metrics.recordTaskExecution(null, 100);

        var coderTimer = registry.find("abathur.task.duration").tag("agent", "coder").timer();
        var defaultTimer = registry.find("abathur.task.duration").tag("agent", "default").timer();

        assertNotNull(coderTimer);
        assertNotNull(defaultTimer);
        assertEquals(2, coderTimer.count());
        assertEquals(1, defaultTimer.count());
    }

    @Test
    @DisplayName("recordExecutionOutcome increments the counter for each outcome")
    void recordExecutionOutcome() {
        metrics.recordExecutionOutcome("success");
        metrics.recordExecutionOutcome("success");
        metrics.recordExecutionOutcome("failure");

        assertEquals(2.0, registry.find("abathur.task.executions").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.find("abathur.task.executions").tag("outcome", "failure").counter().count());
        assertNull(registry.find("abathur.task.executions").tag("outcome", "cancelled").counter());
    }

    @Test
    @DisplayName("recordCascadeCancellation counts cascades and their size")
    void recordCascadeCancellation() {
        metrics.recordCascadeCancellation(4);
        metrics.recordCascadeCancellation(2);

        assertEquals(2.0, registry.find("abathur.task.cascade_cancellations").counter().count());
        var summary = registry.find("abathur.task.cascade_size").summary();
        assertNotNull(summary);
        assertEquals(6.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordPriorityRecalculation adds the number of tasks")
    void recordPriorityRecalculation() {
        metrics.recordPriorityRecalculation(3);
        metrics.recordPriorityRecalculation(1);

        assertEquals(4.0, registry.find("abathur.priority.recalculations").counter().count());
    }

    @Test
    @DisplayName("retry and stale recovery counters")
    void retryAndStaleRecovery() {
        metrics.recordRetry();
        metrics.recordStaleRecovery(2);

        assertEquals(1.0, registry.find("abathur.task.retries").counter().count());
        assertEquals(2.0, registry.find("abathur.task.stale_recoveries").counter().count());
    }
}

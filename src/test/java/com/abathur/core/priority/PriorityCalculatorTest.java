package com.abathur.core.priority;

import com.abathur.core.MutableClock;
import com.abathur.core.dependency.DependencyResolver;
import com.abathur.core.metrics.AbathurMetrics;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskSource;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.store.InMemoryTaskStore;
import com.abathur.core.store.TaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PriorityCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final double EPSILON = 1e-9;

    private MutableClock clock;
    private TaskStore store;
    private PriorityCalculator calculator;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryTaskStore(clock);
        registry = new SimpleMeterRegistry();
        var resolver = new DependencyResolver(store, Duration.ZERO, clock);
        calculator = new PriorityCalculator(resolver, store, PriorityWeights.DEFAULTS, clock, 5,
                new AbathurMetrics(registry));
    }

    private Task add(Task.Builder builder) {
        return store.insertTask(builder.build());
    }

    @Nested
    @DisplayName("sub-scores")
    class SubScoreTests {

        @Test
        @DisplayName("base score is basePriority times ten")
        void baseScore() {
            assertEquals(0.0, PriorityCalculator.baseScore(0));
            assertEquals(50.0, PriorityCalculator.baseScore(5));
            assertEquals(100.0, PriorityCalculator.baseScore(10));
        }

        @Test
        @DisplayName("depth score grows by ten per level and caps at 100")
        void depthScore() {
            assertEquals(0.0, PriorityCalculator.depthScore(0));
            assertEquals(30.0, PriorityCalculator.depthScore(3));
            assertEquals(100.0, PriorityCalculator.depthScore(10));
            assertEquals(100.0, PriorityCalculator.depthScore(25));
        }

        @ParameterizedTest(name = "{0} blocked -> {1}")
        @CsvSource({
                "0, 0", "1, 20", "2, 20", "3, 40", "5, 40",
                "6, 60", "10, 60", "11, 80", "20, 80", "21, 100", "500, 100"
        })
        @DisplayName("blocking score buckets")
        void blockingBuckets(int blocked, double expected) {
            assertEquals(expected, PriorityCalculator.blockingScore(blocked));
        }

        @Test
        @DisplayName("source score ranks humans first")
        void sourceScore() {
            assertEquals(100.0, PriorityCalculator.sourceScore(TaskSource.HUMAN));
            assertEquals(75.0, PriorityCalculator.sourceScore(TaskSource.AGENT_REQUIREMENTS));
            assertEquals(50.0, PriorityCalculator.sourceScore(TaskSource.AGENT_PLANNER));
            assertEquals(25.0, PriorityCalculator.sourceScore(TaskSource.AGENT_IMPLEMENTATION));
            assertEquals(0.0, PriorityCalculator.sourceScore(null));
        }
    }

    @Nested
    @DisplayName("urgency")
    class UrgencyTests {

        @Test
        @DisplayName("no deadline means no urgency")
        void noDeadline() {
            assertEquals(0.0, PriorityCalculator.urgencyScore(null, 600L, NOW));
        }

        @Test
        @DisplayName("a passed deadline is maximally urgent")
        void pastDeadline() {
            assertEquals(100.0, PriorityCalculator.urgencyScore(NOW.minusSeconds(1), null, NOW));
            assertEquals(100.0, PriorityCalculator.urgencyScore(NOW, null, NOW));
        }

        @Test
        @DisplayName("less time left than the estimate is maximally urgent")
        void insufficientTime() {
            assertEquals(100.0, PriorityCalculator.urgencyScore(NOW.plusSeconds(7200), 10_800L, NOW));
            assertEquals(50.0, PriorityCalculator.urgencyScore(NOW.plusSeconds(7200), 3600L, NOW));
        }

        @ParameterizedTest(name = "{0}s left -> {1}")
        @CsvSource({
                "30, 100", "59, 100", "60, 80", "3599, 80", "3600, 50",
                "86399, 50", "86400, 30", "604799, 30", "604800, 10", "5000000, 10"
        })
        @DisplayName("stepped by time remaining")
        void steps(long secondsLeft, double expected) {
            assertEquals(expected, PriorityCalculator.urgencyScore(NOW.plusSeconds(secondsLeft), null, NOW));
        }
    }

    @Nested
    @DisplayName("calculatePriority")
    class CalculateTests {

        @Test
        @DisplayName("base 5, depth 2, blocking 4, human, no deadline scores 31")
        void weightedScenario() {
            add(Task.builder("a").status(TaskStatus.COMPLETED));
            add(Task.builder("b").status(TaskStatus.COMPLETED).dependencies(List.of("a")));
            Task x = add(Task.builder("x").status(TaskStatus.READY).basePriority(5)
                    .source(TaskSource.HUMAN).dependencies(List.of("b")));
            for (int i = 0; i < 4; i++) {
                add(Task.builder("blocked" + i).status(TaskStatus.BLOCKED).dependencies(List.of("x")));
            }

            assertEquals(31.0, calculator.calculatePriority(x), EPSILON);
        }

        @Test
        @DisplayName("stays within 0 and 100 at both extremes")
        void bounds() {
            Task low = add(Task.builder("low").status(TaskStatus.READY).basePriority(0)
                    .source(TaskSource.AGENT_IMPLEMENTATION));
            assertEquals(0.30 * 0 + 0.05 * 25, calculator.calculatePriority(low), EPSILON);

            add(Task.builder("r0").status(TaskStatus.COMPLETED));
            String prev = "r0";
            for (int i = 1; i <= 12; i++) {
                add(Task.builder("r" + i).status(TaskStatus.COMPLETED).dependencies(List.of(prev)));
                prev = "r" + i;
            }
            Task high = add(Task.builder("high").status(TaskStatus.READY).basePriority(10)
                    .deadline(NOW.minusSeconds(5)).dependencies(List.of(prev)));
            for (int i = 0; i < 25; i++) {
                add(Task.builder("w" + i).status(TaskStatus.BLOCKED).dependencies(List.of("high")));
            }

            double score = calculator.calculatePriority(high);
            assertEquals(100.0, score, EPSILON);
        }

        @Test
        @DisplayName("urgency follows the clock")
        void followsClock() {
            Task t = add(Task.builder("t").status(TaskStatus.READY).basePriority(5)
                    .deadline(NOW.plus(Duration.ofDays(2))));
            double far = calculator.calculatePriority(t);

            clock.advance(Duration.ofDays(2).minusSeconds(30));
            double near = calculator.calculatePriority(t);

            assertEquals(0.25 * (100 - 30), near - far, EPSILON);
        }

        @Test
        @DisplayName("unknown task propagates TaskNotFoundException")
        void unknownTask() {
            assertThrows(TaskNotFoundException.class,
                    () -> calculator.calculatePriority(Task.builder("ghost").build()));
        }
    }

    @Nested
    @DisplayName("recalculation")
    class RecalculationTests {

        @Test
        @DisplayName("recalculate persists the new priority")
        void persists() {
            add(Task.builder("t").status(TaskStatus.READY).basePriority(8));

            Task updated = calculator.recalculate("t");

            assertEquals(0.30 * 80 + 0.05 * 100, updated.calculatedPriority(), EPSILON);
            assertEquals(updated.calculatedPriority(), store.requireTask("t").calculatedPriority());
            assertEquals(2, store.requireTask("t").version());
        }

        @Test
        @DisplayName("recalculating twice without changes gives the same value")
        void idempotent() {
            add(Task.builder("a").status(TaskStatus.READY).basePriority(3));
            add(Task.builder("b").status(TaskStatus.BLOCKED).dependencies(List.of("a")));

            Map<String, Double> first = calculator.recalculatePriorities(List.of("a", "b"));
            Map<String, Double> second = calculator.recalculatePriorities(List.of("a", "b"));

            assertEquals(first, second);
        }

        @Test
        @DisplayName("running and terminal tasks are left untouched")
        void skipsNonSchedulable() {
            add(Task.builder("run").status(TaskStatus.RUNNING).calculatedPriority(12.5));
            add(Task.builder("done").status(TaskStatus.COMPLETED).calculatedPriority(7));

            Map<String, Double> results = calculator.recalculatePriorities(List.of("run", "done"));

            assertTrue(results.isEmpty());
            assertEquals(12.5, store.requireTask("run").calculatedPriority());
            assertEquals(1, store.requireTask("run").version());
        }

        @Test
        @DisplayName("batch recalculation skips missing tasks and carries on")
        void batchSkipsErrors() {
            add(Task.builder("a").status(TaskStatus.READY));

            Map<String, Double> results = calculator.recalculatePriorities(List.of("ghost", "a"));

            assertEquals(List.of("a"), List.copyOf(results.keySet()));
            assertEquals(1.0, registry.find("abathur.priority.recalculations").counter().count());
        }

        @Test
        @DisplayName("single recalculation propagates errors")
        void singlePropagates() {
            assertThrows(TaskNotFoundException.class, () -> calculator.recalculate("ghost"));
        }
    }

    @Nested
    @DisplayName("PriorityWeights")
    class WeightTests {

        @Test
        @DisplayName("defaults sum to one")
        void defaults() {
            var w = PriorityWeights.DEFAULTS;
            assertEquals(1.0, w.base() + w.depth() + w.urgency() + w.blocking() + w.source(), 1e-9);
        }

        @Test
        @DisplayName("rejects weights that do not sum to one")
        void rejectsBadSum() {
            assertThrows(IllegalArgumentException.class, () -> new PriorityWeights(0.5, 0.5, 0.5, 0, 0));
        }

        @Test
        @DisplayName("rejects negative weights")
        void rejectsNegative() {
            assertThrows(IllegalArgumentException.class, () -> new PriorityWeights(1.2, -0.2, 0, 0, 0));
        }

        @Test
        @DisplayName("custom weights change the score")
        void customWeights() {
            var baseOnly = new PriorityCalculator(new DependencyResolver(store, Duration.ZERO, clock), store,
                    new PriorityWeights(1.0, 0, 0, 0, 0), clock, 5, null);
            Task t = add(Task.builder("t").status(TaskStatus.READY).basePriority(7));

            assertEquals(70.0, baseOnly.calculatePriority(t), EPSILON);
        }
    }
}

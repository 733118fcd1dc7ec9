package com.abathur.core.dependency;

import com.abathur.core.MutableClock;
import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.DependencyType;
import com.abathur.core.model.ExecutionBatch;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.store.InMemoryTaskStore;
import com.abathur.core.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DependencyResolverTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private TaskStore store;
    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryTaskStore(clock);
        resolver = new DependencyResolver(store, Duration.ofSeconds(60), clock);
    }

    private Task add(String id, TaskStatus status, String... deps) {
        return store.insertTask(Task.builder(id).status(status).dependencies(List.of(deps)).build());
    }

    private Task add(String id, String... deps) {
        return add(id, deps.length == 0 ? TaskStatus.READY : TaskStatus.BLOCKED, deps);
    }

    @Nested
    @DisplayName("calculateDependencyDepth")
    class DepthTests {

        @Test
        @DisplayName("a task without prerequisites has depth 0")
        void rootDepth() {
            add("a");
            assertEquals(0, resolver.calculateDependencyDepth("a"));
        }

        @Test
        @DisplayName("a chain of N tasks has depths 0..N-1")
        void chainDepths() {
            add("t0");
            for (int i = 1; i < 10; i++) {
                add("t" + i, "t" + (i - 1));
            }
            for (int i = 0; i < 10; i++) {
                assertEquals(i, resolver.calculateDependencyDepth("t" + i));
            }
        }

        @Test
        @DisplayName("completed prerequisites still count toward depth")
        void completedStillCounts() {
            add("a", TaskStatus.COMPLETED);
            add("b", TaskStatus.COMPLETED, "a");
            add("c", TaskStatus.READY, "b");

            assertEquals(2, resolver.calculateDependencyDepth("c"));
        }

        @Test
        @DisplayName("depth follows the longest path through a diamond")
        void diamond() {
            add("root");
            add("left", "root");
            add("mid", "root");
            add("right", "mid");
            add("sink", "left", "right");

            assertEquals(3, resolver.calculateDependencyDepth("sink"));
        }

        @Test
        @DisplayName("deep chains do not overflow the stack")
        void deepChain() {
            add("n0");
            for (int i = 1; i < 5000; i++) {
                add("n" + i, "n" + (i - 1));
            }
            assertEquals(4999, resolver.calculateDependencyDepth("n4999"));
        }

        @Test
        @DisplayName("unknown task throws TaskNotFoundException")
        void unknownTask() {
            assertThrows(TaskNotFoundException.class, () -> resolver.calculateDependencyDepth("ghost"));
        }

        @Test
        @DisplayName("a cycle in the stored graph is reported with its path")
        void storedCycle() {
            TaskStore cyclic = mock(TaskStore.class);
            Task a = Task.builder("a").dependencies(List.of("b")).build();
            Task b = Task.builder("b").dependencies(List.of("a")).build();
            when(cyclic.requireTask("a")).thenReturn(a);
            when(cyclic.requireTask("b")).thenReturn(b);
            var cyclicResolver = new DependencyResolver(cyclic, Duration.ofSeconds(60), clock);

            var e = assertThrows(CircularDependencyException.class,
                    () -> cyclicResolver.calculateDependencyDepth("a"));
            assertEquals(List.of("a", "b", "a"), e.getPath());
        }
    }

    @Nested
    @DisplayName("cache")
    class CacheTests {

        @Test
        @DisplayName("repeated depth lookups are served from the cache")
        void depthCached() {
            TaskStore spyStore = spy(new InMemoryTaskStore(clock));
            spyStore.insertTask(Task.builder("a").status(TaskStatus.READY).build());
            spyStore.insertTask(Task.builder("b").status(TaskStatus.BLOCKED).dependencies(List.of("a")).build());
            var cachingResolver = new DependencyResolver(spyStore, Duration.ofSeconds(60), clock);

            assertEquals(1, cachingResolver.calculateDependencyDepth("b"));
            clearInvocations(spyStore);
            assertEquals(1, cachingResolver.calculateDependencyDepth("b"));

            verify(spyStore, never()).requireTask(anyString());
        }

        @Test
        @DisplayName("entries expire after the TTL")
        void ttlExpiry() {
            add("a");
            add("b", "a");
            assertEquals(List.of("b"), resolver.getBlockedTasks("a"));

            add("c", "a");
            assertEquals(List.of("b"), resolver.getBlockedTasks("a"), "still cached");

            clock.advance(Duration.ofSeconds(61));
            assertEquals(List.of("b", "c"), resolver.getBlockedTasks("a"));
        }

        @Test
        @DisplayName("invalidateCache drops cached results immediately")
        void invalidate() {
            add("a");
            add("b", "a");
            assertEquals(1, resolver.getBlockedTasks("a").size());

            add("c", "a");
            resolver.invalidateCache();

            assertEquals(2, resolver.getBlockedTasks("a").size());
        }
    }

    @Nested
    @DisplayName("cycle detection")
    class CycleTests {

        @Test
        @DisplayName("adding a back edge is detected")
        void backEdge() {
            add("a");
            add("b", "a");
            add("c", "b");

            assertTrue(resolver.detectCycle("a", "c"));
            assertFalse(resolver.detectCycle("c", "a"));
        }

        @Test
        @DisplayName("self-dependency is a cycle")
        void selfEdge() {
            add("a");
            assertTrue(resolver.detectCycle("a", "a"));
        }

        @Test
        @DisplayName("validateNewDependency throws with the would-be cycle and changes nothing")
        void validateThrows() {
            add("a");
            add("b", "a");

            var e = assertThrows(CircularDependencyException.class, () -> resolver.validateNewDependency("a", "b"));

            assertEquals(List.of("a", "b", "a"), e.getPath());
            assertTrue(store.requireTask("a").dependencies().isEmpty());
            assertEquals(1, store.requireTask("a").version());
        }

        @Test
        @DisplayName("independent tasks never form a cycle")
        void unrelated() {
            add("a");
            add("b");
            assertDoesNotThrow(() -> resolver.validateNewDependency("a", "b"));
        }
    }

    @Nested
    @DisplayName("readiness")
    class ReadinessTests {

        @Test
        @DisplayName("sequential dependencies need every prerequisite completed")
        void sequential() {
            add("a", TaskStatus.COMPLETED);
            add("b", TaskStatus.RUNNING);
            add("c", TaskStatus.BLOCKED, "a", "b");

            assertFalse(resolver.areAllDependenciesMet("c"));

            Task b = store.requireTask("b");
            store.updateTask(b.withStatus(TaskStatus.COMPLETED, T0), b.version());
            assertTrue(resolver.areAllDependenciesMet("c"));
        }

        @Test
        @DisplayName("parallel dependencies need requiredCompletions prerequisites completed")
        void parallelThreshold() {
            add("a", TaskStatus.COMPLETED);
            add("b", TaskStatus.FAILED);
            add("c", TaskStatus.READY);
            store.insertTask(Task.builder("p")
                    .status(TaskStatus.BLOCKED)
                    .dependencies(List.of("a", "b", "c"))
                    .dependencyType(DependencyType.PARALLEL)
                    .requiredCompletions(2)
                    .build());

            assertFalse(resolver.areAllDependenciesMet("p"));

            Task c = store.requireTask("c");
            store.updateTask(c.withStatus(TaskStatus.COMPLETED, T0), c.version());
            assertTrue(resolver.areAllDependenciesMet("p"));
        }

        @Test
        @DisplayName("a task without prerequisites is always ready")
        void noDependencies() {
            add("a");
            assertTrue(resolver.areAllDependenciesMet("a"));
        }

        @Test
        @DisplayName("getBlockedTasks ignores terminal dependents")
        void blockedIgnoresTerminal() {
            add("a");
            add("b", TaskStatus.BLOCKED, "a");
            add("c", TaskStatus.CANCELLED, "a");
            add("d", TaskStatus.BLOCKED, "b");

            assertEquals(List.of("b"), resolver.getBlockedTasks("a"));
        }
    }

    @Nested
    @DisplayName("ordering and plans")
    class OrderingTests {

        @Test
        @DisplayName("topologicalOrder puts prerequisites first")
        void prerequisitesFirst() {
            add("a");
            add("b", "a");
            add("c", "b");
            add("d", "a");

            List<String> order = resolver.topologicalOrder(List.of("c", "d", "b", "a"));

            assertEquals(4, order.size());
            assertTrue(order.indexOf("a") < order.indexOf("b"));
            assertTrue(order.indexOf("b") < order.indexOf("c"));
            assertTrue(order.indexOf("a") < order.indexOf("d"));
        }

        @Test
        @DisplayName("topologicalOrder prefers higher priority among available tasks")
        void priorityTieBreak() {
            store.insertTask(Task.builder("low").status(TaskStatus.READY).calculatedPriority(10).build());
            store.insertTask(Task.builder("high").status(TaskStatus.READY).calculatedPriority(90).build());

            assertEquals(List.of("high", "low"), resolver.topologicalOrder(List.of("low", "high")));
        }

        @Test
        @DisplayName("topologicalOrder ignores prerequisites outside the set")
        void outsideSet() {
            add("a");
            add("b", "a");
            assertEquals(List.of("b"), resolver.topologicalOrder(List.of("b")));
        }

        @Test
        @DisplayName("topologicalOrder reports a cycle among the given tasks")
        void cycleInSet() {
            TaskStore cyclic = mock(TaskStore.class);
            Task a = Task.builder("a").dependencies(List.of("b")).build();
            Task b = Task.builder("b").dependencies(List.of("a")).build();
            Task c = Task.builder("c").build();
            when(cyclic.requireTask("a")).thenReturn(a);
            when(cyclic.requireTask("b")).thenReturn(b);
            when(cyclic.requireTask("c")).thenReturn(c);
            var cyclicResolver = new DependencyResolver(cyclic, Duration.ofSeconds(60), clock);

            var e = assertThrows(CircularDependencyException.class,
                    () -> cyclicResolver.topologicalOrder(List.of("a", "b", "c")));

            List<String> path = e.getPath();
            assertEquals(path.get(0), path.get(path.size() - 1));
            assertEquals(Set.of("a", "b"), Set.copyOf(path));
        }

        @Test
        @DisplayName("executionPlan groups tasks into parallel levels")
        void executionPlan() {
            add("a");
            add("b");
            add("c", "a", "b");
            add("d", "c");
            add("e", "a");

            List<ExecutionBatch> plan = resolver.executionPlan(List.of("a", "b", "c", "d", "e"));

            assertEquals(3, plan.size());
            assertEquals(Set.of("a", "b"), Set.copyOf(plan.get(0).taskIds()));
            assertEquals(Set.of("c", "e"), Set.copyOf(plan.get(1).taskIds()));
            assertEquals(List.of("d"), plan.get(2).taskIds());
            assertEquals(2, plan.get(2).level());
        }

        @Test
        @DisplayName("dependencyChain groups transitive prerequisites by depth")
        void dependencyChain() {
            add("a");
            add("b", "a");
            add("x");
            add("c", "b", "x");

            List<List<String>> chain = resolver.dependencyChain("c");

            assertEquals(2, chain.size());
            assertEquals(Set.of("a", "x"), Set.copyOf(chain.get(0)));
            assertEquals(List.of("b"), chain.get(1));
        }

        @Test
        @DisplayName("transitiveDependents walks the reverse graph breadth-first")
        void transitiveDependents() {
            add("a");
            add("b", "a");
            add("c", "a");
            add("d", "b", "c");

            List<String> dependents = resolver.transitiveDependents("a");

            assertEquals(3, dependents.size());
            assertEquals("d", dependents.get(2));
            assertEquals(Set.of("b", "c"), Set.copyOf(dependents.subList(0, 2)));
            assertTrue(resolver.transitiveDependents("d").isEmpty());
        }
    }

    @Test
    @DisplayName("getBlockedTasks lists direct non-terminal dependents in insertion order")
    void blockedOrder() {
        add("a");
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            add("dep" + i, "a");
            expected.add("dep" + i);
        }
        assertEquals(expected, resolver.getBlockedTasks("a"));
    }
}

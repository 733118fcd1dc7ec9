package com.abathur.core.dependency;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.ExecutionBatch;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.store.DependencyPaths;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Graph questions over the dependency edges held in the {@link TaskStore}.
 * <p>
 * Never mutates tasks. Depth and blocked-task answers are cached for a fixed TTL; any
 * call to {@link #invalidateCache()} drops every entry, and a computation that raced
 * with an invalidation does not repopulate the cache.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final TaskStore store;
    private final Duration cacheTtl;
    private final Clock clock;

    private final ReentrantLock cacheLock = new ReentrantLock();
    private final Map<String, CacheEntry<Integer>> depthCache = new HashMap<>();
    private final Map<String, CacheEntry<List<String>>> blockedCache = new HashMap<>();
    private long generation;

    private record CacheEntry<T>(T value, Instant expiresAt) {}

    @Autowired
    public DependencyResolver(TaskStore store, AbathurProperties properties, Clock clock) {
        this(store, properties.getDependency().getCacheTtl(), clock);
    }

    public DependencyResolver(TaskStore store, Duration cacheTtl, Clock clock) {
        this.store = store;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    /**
     * Length of the longest dependency chain below {@code taskId}: 0 for a task with no
     * prerequisites, otherwise one more than its deepest prerequisite. Every edge counts,
     * whether or not the prerequisite has completed.
     *
     * @throws TaskNotFoundException       when the task or one of its prerequisites is missing
     * @throws CircularDependencyException when the stored graph contains a cycle through the task
     */
    public int calculateDependencyDepth(String taskId) {
        long startGeneration;
        Map<String, Integer> memo = new HashMap<>();
        cacheLock.lock();
        try {
            startGeneration = generation;
            Integer cached = cachedValue(depthCache, taskId);
            if (cached != null) {
                log.debug("Depth cache hit for {}", taskId);
                return cached;
            }
        } finally {
            cacheLock.unlock();
        }

        record Frame(String id, List<String> deps, int[] next) {}

        Deque<Frame> stack = new ArrayDeque<>();
        LinkedHashSet<String> onPath = new LinkedHashSet<>();
        stack.push(new Frame(taskId, store.requireTask(taskId).dependencies(), new int[]{0}));
        onPath.add(taskId);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next()[0] < frame.deps().size()) {
                String dep = frame.deps().get(frame.next()[0]++);
                if (memo.containsKey(dep)) {
                    continue;
                }
                Integer cached = cachedDepth(dep);
                if (cached != null) {
                    memo.put(dep, cached);
                    continue;
                }
                if (onPath.contains(dep)) {
                    throw new CircularDependencyException("Dependency cycle detected", cyclePath(onPath, dep));
                }
                stack.push(new Frame(dep, store.requireTask(dep).dependencies(), new int[]{0}));
                onPath.add(dep);
            } else {
                stack.pop();
                onPath.remove(frame.id());
                int depth = 0;
                for (String dep : frame.deps()) {
                    depth = Math.max(depth, memo.get(dep) + 1);
                }
                memo.put(frame.id(), depth);
            }
        }

        cacheLock.lock();
        try {
            if (generation == startGeneration) {
                Instant expiresAt = clock.instant().plus(cacheTtl);
                memo.forEach((id, depth) -> depthCache.put(id, new CacheEntry<>(depth, expiresAt)));
            }
        } finally {
            cacheLock.unlock();
        }
        return memo.get(taskId);
    }

    /**
     * True when adding "{@code taskId} depends on {@code newDependencyId}" would close a
     * cycle, i.e. {@code taskId} is already reachable from {@code newDependencyId}.
     */
    public boolean detectCycle(String taskId, String newDependencyId) {
        return DependencyPaths.cycleIfAdded(taskId, newDependencyId, this::dependenciesOf).isPresent();
    }

    /**
     * @throws CircularDependencyException carrying the would-be cycle
     */
    public void validateNewDependency(String taskId, String newDependencyId) {
        DependencyPaths.cycleIfAdded(taskId, newDependencyId, this::dependenciesOf).ifPresent(path -> {
            throw new CircularDependencyException("Dependency would create a cycle", path);
        });
    }

    /**
     * Non-terminal tasks that list {@code prerequisiteId} among their dependencies.
     */
    public List<String> getBlockedTasks(String prerequisiteId) {
        long startGeneration;
        cacheLock.lock();
        try {
            startGeneration = generation;
            List<String> cached = cachedValue(blockedCache, prerequisiteId);
            if (cached != null) {
                return cached;
            }
        } finally {
            cacheLock.unlock();
        }

        List<String> blocked = new ArrayList<>();
        for (String dependentId : store.findDependents(prerequisiteId)) {
            store.getTask(dependentId)
                    .filter(t -> !t.isTerminal())
                    .ifPresent(t -> blocked.add(t.id()));
        }
        List<String> result = List.copyOf(blocked);

        cacheLock.lock();
        try {
            if (generation == startGeneration) {
                blockedCache.put(prerequisiteId, new CacheEntry<>(result, clock.instant().plus(cacheTtl)));
            }
        } finally {
            cacheLock.unlock();
        }
        return result;
    }

    /**
     * Whether the task's prerequisites satisfy its dependency type: all completed for
     * sequential, at least {@code requiredCompletions} completed for parallel.
     */
    public boolean areAllDependenciesMet(String taskId) {
        return areDependenciesMet(store.requireTask(taskId));
    }

    public boolean areDependenciesMet(Task task) {
        if (task.dependencies().isEmpty()) {
            return true;
        }
        int completed = 0;
        for (String dep : task.dependencies()) {
            if (store.getTask(dep).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false)) {
                completed++;
            }
        }
        return completed >= task.completionsNeeded();
    }

    /**
     * Orders {@code taskIds} so every task follows its prerequisites within the set.
     * Among tasks available at the same point, higher calculated priority comes first,
     * then earlier submission.
     *
     * @throws CircularDependencyException when the subgraph contains a cycle
     */
    public List<String> topologicalOrder(Collection<String> taskIds) {
        Map<String, Task> tasks = loadAll(taskIds);
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependentsInSet = new HashMap<>();
        for (Task task : tasks.values()) {
            int degree = 0;
            for (String dep : task.dependencies()) {
                if (tasks.containsKey(dep)) {
                    degree++;
                    dependentsInSet.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
                }
            }
            inDegree.put(task.id(), degree);
        }

        PriorityQueue<Task> ready = new PriorityQueue<>(Task.DISPATCH_ORDER);
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(tasks.get(id));
            }
        });

        List<String> order = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            Task next = ready.poll();
            order.add(next.id());
            for (String dependent : dependentsInSet.getOrDefault(next.id(), List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(tasks.get(dependent));
                }
            }
        }

        if (order.size() < tasks.size()) {
            Set<String> remaining = new LinkedHashSet<>(tasks.keySet());
            order.forEach(remaining::remove);
            throw new CircularDependencyException("Dependency cycle detected", findCycle(remaining, tasks));
        }
        return order;
    }

    /**
     * Groups {@code taskIds} into levels: a task's level is one more than the highest
     * level among its prerequisites inside the set. Tasks sharing a level can run in parallel.
     */
    public List<ExecutionBatch> executionPlan(Collection<String> taskIds) {
        List<String> order = topologicalOrder(taskIds);
        Map<String, Task> tasks = loadAll(order);
        Map<String, Integer> levels = new HashMap<>();
        TreeMap<Integer, List<String>> batches = new TreeMap<>();
        for (String id : order) {
            int level = 0;
            for (String dep : tasks.get(id).dependencies()) {
                Integer depLevel = levels.get(dep);
                if (depLevel != null) {
                    level = Math.max(level, depLevel + 1);
                }
            }
            levels.put(id, level);
            batches.computeIfAbsent(level, k -> new ArrayList<>()).add(id);
        }
        List<ExecutionBatch> plan = new ArrayList<>(batches.size());
        batches.forEach((level, ids) -> plan.add(new ExecutionBatch(level, ids)));
        return plan;
    }

    /**
     * Every transitive prerequisite of {@code taskId}, grouped by dependency depth so that
     * the first level can run first.
     */
    public List<List<String>> dependencyChain(String taskId) {
        Set<String> prerequisites = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(store.requireTask(taskId).dependencies());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (prerequisites.add(id)) {
                queue.addAll(dependenciesOf(id));
            }
        }
        TreeMap<Integer, List<String>> byDepth = new TreeMap<>();
        for (String id : prerequisites) {
            byDepth.computeIfAbsent(calculateDependencyDepth(id), k -> new ArrayList<>()).add(id);
        }
        return byDepth.values().stream().map(List::copyOf).toList();
    }

    /**
     * All tasks that depend on {@code taskId} directly or indirectly, any status, in
     * breadth-first order.
     */
    public List<String> transitiveDependents(String taskId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(store.findDependents(taskId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!id.equals(taskId) && seen.add(id)) {
                queue.addAll(store.findDependents(id));
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Drops every cached depth and blocked-task entry.
     */
    public void invalidateCache() {
        cacheLock.lock();
        try {
            generation++;
            depthCache.clear();
            blockedCache.clear();
        } finally {
            cacheLock.unlock();
        }
        log.debug("Dependency cache invalidated");
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private List<String> dependenciesOf(String id) {
        return store.getTask(id).map(Task::dependencies).orElse(List.of());
    }

    private Integer cachedDepth(String id) {
        cacheLock.lock();
        try {
            return cachedValue(depthCache, id);
        } finally {
            cacheLock.unlock();
        }
    }

    private <T> T cachedValue(Map<String, CacheEntry<T>> cache, String id) {
        CacheEntry<T> entry = cache.get(id);
        if (entry == null) {
            return null;
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            cache.remove(id);
            return null;
        }
        return entry.value();
    }

    private Map<String, Task> loadAll(Collection<String> ids) {
        Map<String, Task> tasks = new LinkedHashMap<>();
        for (String id : ids) {
            tasks.put(id, store.requireTask(id));
        }
        return tasks;
    }

    private static List<String> cyclePath(LinkedHashSet<String> onPath, String repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String id : onPath) {
            inCycle |= id.equals(repeated);
            if (inCycle) {
                path.add(id);
            }
        }
        path.add(repeated);
        return path;
    }

    /**
     * Every node left over by Kahn's algorithm has a prerequisite that is also left over,
     * so following first prerequisites must revisit a node.
     */
    private static List<String> findCycle(Set<String> remaining, Map<String, Task> tasks) {
        List<String> walk = new ArrayList<>();
        String current = remaining.iterator().next();
        while (!walk.contains(current)) {
            walk.add(current);
            current = tasks.get(current).dependencies().stream()
                    .filter(remaining::contains)
                    .findFirst()
                    .orElseThrow();
        }
        List<String> cycle = new ArrayList<>(walk.subList(walk.indexOf(current), walk.size()));
        cycle.add(current);
        return cycle;
    }
}

package com.abathur.core.store;

import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskQueueException;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link TaskStore}. State is lost on restart.
 * <p>
 * A read/write lock gives many concurrent readers and a single writer. The reverse
 * dependency index is maintained alongside the rows.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Task> tasks = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Task> getTask(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tasks.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Task insertTask(Task task) {
        lock.writeLock().lock();
        try {
            if (tasks.containsKey(task.id())) {
                throw new TaskQueueException("Task already exists: " + task.id());
            }
            for (String dep : task.dependencies()) {
                if (dep.equals(task.id())) {
                    throw new CircularDependencyException("Task cannot depend on itself", List.of(dep, dep));
                }
                if (!tasks.containsKey(dep)) {
                    throw new TaskNotFoundException(dep);
                }
            }
            var builder = task.toBuilder().version(1);
            if (task.submittedAt() == null) {
                builder.submittedAt(clock.instant());
            }
            Task stored = builder.build();
            tasks.put(stored.id(), stored);
            for (String dep : stored.dependencies()) {
                dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(stored.id());
            }
            log.debug("Inserted task {} with {} dependencies", stored.id(), stored.dependencies().size());
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Task updateTask(Task task, long expectedVersion) {
        lock.writeLock().lock();
        try {
            Task current = tasks.get(task.id());
            if (current == null) {
                throw new TaskNotFoundException(task.id());
            }
            if (current.version() != expectedVersion) {
                throw new VersionConflictException(task.id(), expectedVersion, current.version());
            }
            Task stored = task.toBuilder()
                    .dependencies(current.dependencies())
                    .version(expectedVersion + 1)
                    .build();
            tasks.put(stored.id(), stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Task> getNextReadyTask() {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.READY)
                    .min(Task.DISPATCH_ORDER);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Task> listTasks(Set<TaskStatus> statusFilter, int limit) {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                    .filter(t -> statusFilter == null || statusFilter.isEmpty() || statusFilter.contains(t.status()))
                    .sorted(Task.DISPATCH_ORDER)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Task insertDependency(String taskId, String dependencyId) {
        lock.writeLock().lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                throw new TaskNotFoundException(taskId);
            }
            if (!tasks.containsKey(dependencyId)) {
                throw new TaskNotFoundException(dependencyId);
            }
            if (task.dependencies().contains(dependencyId)) {
                return task;
            }
            var cycle = DependencyPaths.cycleIfAdded(taskId, dependencyId,
                    id -> tasks.containsKey(id) ? tasks.get(id).dependencies() : List.of());
            if (cycle.isPresent()) {
                throw new CircularDependencyException("Dependency would create a cycle", cycle.get());
            }
            List<String> deps = new ArrayList<>(task.dependencies());
            deps.add(dependencyId);
            Task stored = task.toBuilder().dependencies(deps).version(task.version() + 1).build();
            tasks.put(taskId, stored);
            dependents.computeIfAbsent(dependencyId, k -> new LinkedHashSet<>()).add(taskId);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> findDependents(String prerequisiteId) {
        lock.readLock().lock();
        try {
            return List.copyOf(dependents.getOrDefault(prerequisiteId, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Clock clock() {
        return clock;
    }
}

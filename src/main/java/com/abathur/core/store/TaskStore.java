package com.abathur.core.store;

import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.InvalidStatusTransitionException;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.VersionConflictException;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable keyed storage for {@link Task} rows.
 * <p>
 * Implementations serialize writers and allow concurrent readers. Every successful write
 * stores {@code version + 1}; a write against a stale version fails with
 * {@link VersionConflictException} and nothing is changed.
 */
public interface TaskStore {

    Optional<Task> getTask(String id);

    default Task requireTask(String id) {
        return getTask(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /**
     * Stores a new task with version 1 together with its dependency edges.
     *
     * @return the stored task
     * @throws TaskNotFoundException       when a prerequisite does not exist
     * @throws CircularDependencyException when the task lists itself as a prerequisite
     */
    Task insertTask(Task task);

    /**
     * Replaces every column of the task except its dependency list, which only changes
     * through {@link #insertDependency}.
     *
     * @return the stored task carrying {@code expectedVersion + 1}
     */
    Task updateTask(Task task, long expectedVersion);

    /**
     * Moves a task to {@code newStatus}, stamping start or completion time as appropriate.
     *
     * @throws InvalidStatusTransitionException when the state machine forbids the move
     */
    default Task updateStatus(String id, TaskStatus newStatus, long expectedVersion) {
        Task current = requireTask(id);
        if (current.version() != expectedVersion) {
            throw new VersionConflictException(id, expectedVersion, current.version());
        }
        if (!current.status().canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(id, current.status(), newStatus);
        }
        return updateTask(current.withStatus(newStatus, clock().instant()), expectedVersion);
    }

    /**
     * Highest-priority {@link TaskStatus#READY} task in {@link Task#DISPATCH_ORDER}, without claiming it.
     */
    Optional<Task> getNextReadyTask();

    /**
     * Tasks in {@link Task#DISPATCH_ORDER}.
     *
     * @param statusFilter statuses to include; empty means all
     * @param limit        maximum rows returned
     */
    List<Task> listTasks(Set<TaskStatus> statusFilter, int limit);

    default List<Task> listTasks(Set<TaskStatus> statusFilter) {
        return listTasks(statusFilter, Integer.MAX_VALUE);
    }

    /**
     * Appends {@code dependencyId} to the prerequisites of {@code taskId}. Adding an edge
     * that already exists is a no-op.
     *
     * @return the stored dependent task
     * @throws CircularDependencyException when the edge would close a cycle; nothing is written
     */
    Task insertDependency(String taskId, String dependencyId);

    /**
     * Ids of tasks listing {@code prerequisiteId} among their dependencies, any status.
     * Served from a reverse index.
     */
    List<String> findDependents(String prerequisiteId);

    /**
     * Cheap reachability check used by health checks.
     */
    boolean isAvailable();

    Clock clock();
}

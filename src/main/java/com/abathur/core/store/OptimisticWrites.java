package com.abathur.core.store;

import com.abathur.core.model.Task;
import com.abathur.core.model.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * Read-modify-write against a {@link TaskStore} with bounded retry on version conflicts.
 */
public final class OptimisticWrites {

    private static final Logger log = LoggerFactory.getLogger(OptimisticWrites.class);

    private OptimisticWrites() {}

    /**
     * Re-reads the task and applies {@code change} until the write lands or
     * {@code maxAttempts} conflicts have occurred. {@code change} may return null to
     * leave the task as it is, or throw to abort.
     *
     * @return the stored task, or the unchanged current task when {@code change} returned null
     * @throws VersionConflictException when every attempt lost a race
     */
    public static Task update(TaskStore store, String taskId, int maxAttempts, UnaryOperator<Task> change) {
        VersionConflictException last = null;
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            Task current = store.requireTask(taskId);
            Task updated = change.apply(current);
            if (updated == null) {
                return current;
            }
            try {
                return store.updateTask(updated, current.version());
            } catch (VersionConflictException e) {
                last = e;
                log.debug("Version conflict on task {} (attempt {}/{})", taskId, attempt, maxAttempts);
            }
        }
        throw last;
    }
}

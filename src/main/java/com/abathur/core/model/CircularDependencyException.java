package com.abathur.core.model;

import java.util.List;

/**
 * Thrown when a dependency edge would close a cycle. Nothing is persisted when this is raised.
 */
public class CircularDependencyException extends TaskQueueException {

    private final List<String> path;

    public CircularDependencyException(String message, List<String> path) {
        super(message + ": " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /** Task ids forming the cycle, first and last entries equal. */
    public List<String> getPath() {
        return path;
    }
}

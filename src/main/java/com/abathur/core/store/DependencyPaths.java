package com.abathur.core.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Breadth-first path search over dependency edges.
 */
public final class DependencyPaths {

    private DependencyPaths() {}

    /**
     * Finds a path from {@code start} to {@code target} following {@code edges}.
     *
     * @return the ids visited, both ends included, or empty when {@code target} is unreachable
     */
    public static Optional<List<String>> findPath(String start, String target,
                                                  Function<String, List<String>> edges) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parent.put(start, null);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                List<String> path = new ArrayList<>();
                for (String step = current; step != null; step = parent.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return Optional.of(path);
            }
            for (String next : edges.apply(current)) {
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Path that adding "{@code taskId} depends on {@code dependencyId}" would close, or empty.
     * The returned cycle starts and ends with {@code taskId}.
     */
    public static Optional<List<String>> cycleIfAdded(String taskId, String dependencyId,
                                                      Function<String, List<String>> dependenciesOf) {
        if (taskId.equals(dependencyId)) {
            return Optional.of(List.of(taskId, taskId));
        }
        return findPath(dependencyId, taskId, dependenciesOf).map(path -> {
            List<String> cycle = new ArrayList<>(path.size() + 1);
            cycle.add(taskId);
            cycle.addAll(path);
            return cycle;
        });
    }
}

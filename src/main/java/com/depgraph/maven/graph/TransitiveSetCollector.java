package com.depgraph.maven.graph;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Flat set of everything reachable from a package. Unlike
 * {@link DependencyResolver} this walk tolerates cycles: visited packages are
 * simply not enqueued again.
 */
public final class TransitiveSetCollector {

    /**
     * Breadth-first collection of all packages reachable from {@code root}.
     *
     * @return packages in discovery order, never containing {@code root};
     *         empty if {@code root} is not declared in {@code graph}
     */
    public static Set<String> allTransitiveDependencies(GraphSource graph, String root) {
        Set<String> reached = new LinkedHashSet<>();
        if (!graph.contains(root)) {
            return reached;
        }

        Set<String> visited = new HashSet<>();
        visited.add(root);
        Queue<String> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependency : graph.edgesOf(current)) {
                if (visited.add(dependency)) {
                    reached.add(dependency);
                    queue.add(dependency);
                }
            }
        }
        return reached;
    }

    private TransitiveSetCollector() {
    }
}

package com.depgraph.maven.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency closure of a package by depth-first expansion of a
 * {@link GraphSource}.
 * <p>
 * Two separate checks guard the walk:
 * <ul>
 *   <li>the ancestor path: reaching a package already on it is a cycle and aborts the walk;</li>
 *   <li>the visited set: a package reached again from another branch (a diamond) is not
 *       expanded a second time.</li>
 * </ul>
 * Sub-results never overwrite an entry already recorded, so every package keeps the
 * reference list and position of its first visit.
 */
public final class DependencyResolver {

    /**
     * Resolves the complete closure reachable from {@code root}.
     *
     * @param graph the graph to walk; never modified
     * @param root  package to start from; need not be declared in {@code graph}
     * @return closure in first-visit order
     * @throws CircularDependencyException if a package recurs within its own ancestor chain
     */
    public static ClosureGraph resolve(GraphSource graph, String root) throws CircularDependencyException {
        Map<String, List<String>> entries = expand(graph, root, new HashSet<>(), List.of());
        return new ClosureGraph(entries);
    }

    private static Map<String, List<String>> expand(
            GraphSource graph,
            String packageName,
            Set<String> visited,
            List<String> path) throws CircularDependencyException {
        if (path.contains(packageName)) {
            throw new CircularDependencyException(packageName, path);
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        if (!visited.add(packageName)) {
            result.put(packageName, List.of());
            return result;
        }

        List<String> dependencies = graph.edgesOf(packageName);
        result.put(packageName, List.copyOf(dependencies));

        List<String> childPath = new ArrayList<>(path);
        childPath.add(packageName);
        childPath = List.copyOf(childPath);

        for (String dependency : dependencies) {
            for (Map.Entry<String, List<String>> entry : expand(graph, dependency, visited, childPath).entrySet()) {
                result.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private DependencyResolver() {
    }
}

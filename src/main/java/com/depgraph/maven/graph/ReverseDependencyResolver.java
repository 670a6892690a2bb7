package com.depgraph.maven.graph;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Resolves dependents of a package over a reverse index built by
 * {@link ReverseIndexBuilder}.
 */
public final class ReverseDependencyResolver {

    /**
     * Complete reverse closure of {@code root}. Same walk and cycle contract as
     * {@link DependencyResolver#resolve(GraphSource, String)}.
     *
     * @throws CircularDependencyException if a dependent recurs within its own ancestor chain
     */
    public static ClosureGraph resolveReverse(GraphSource reverseIndex, String root)
            throws CircularDependencyException {
        return DependencyResolver.resolve(reverseIndex, root);
    }

    /**
     * Packages that depend on {@code root} directly.
     *
     * @return dependents in index order, without duplicates and without {@code root}
     */
    public static Set<String> directReverseDependencies(GraphSource reverseIndex, String root) {
        return reverseDependenciesWithin(reverseIndex, root, 1);
    }

    /**
     * Breadth-first walk of the reverse index, at most {@code maxDepth} hops from {@code root}.
     * A package reached from several frontier nodes is reported once; {@code root} is never
     * reported even if a cycle leads back to it.
     *
     * @param maxDepth number of hops; zero or less yields an empty set
     */
    public static Set<String> reverseDependenciesWithin(GraphSource reverseIndex, String root, int maxDepth) {
        Set<String> dependents = new LinkedHashSet<>();
        if (maxDepth <= 0) {
            return dependents;
        }

        Set<String> seen = new HashSet<>();
        seen.add(root);
        Queue<String> frontier = new ArrayDeque<>();
        frontier.add(root);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            Queue<String> next = new ArrayDeque<>();
            while (!frontier.isEmpty()) {
                String current = frontier.poll();
                for (String dependent : reverseIndex.edgesOf(current)) {
                    if (seen.add(dependent)) {
                        dependents.add(dependent);
                        next.add(dependent);
                    }
                }
            }
            frontier = next;
        }
        return dependents;
    }

    private ReverseDependencyResolver() {
    }
}

package com.depgraph.maven.graph;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a directed package graph: each package maps to the ordered
 * list of packages it directly depends on.
 * <p>
 * Packages that are referenced but never declared are leaves:
 * {@link #edgesOf(String)} returns an empty list for them.
 */
public interface GraphSource {

    /**
     * Direct dependencies of a package, in declaration order.
     *
     * @param packageName package identifier
     * @return unmodifiable list, empty if the package is not declared
     */
    List<String> edgesOf(String packageName);

    /**
     * Declared packages in declaration order.
     */
    Set<String> packages();

    default boolean contains(String packageName) {
        return packages().contains(packageName);
    }

    default boolean isEmpty() {
        return packages().isEmpty();
    }
}

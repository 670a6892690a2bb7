package com.depgraph.maven.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, insertion-ordered {@link GraphSource} backed by a map of
 * package to direct dependencies.
 * <p>
 * Used both for forward graphs and for reverse indexes (package to dependents).
 */
public final class DependencyGraph implements GraphSource {

    private static final DependencyGraph EMPTY = new DependencyGraph(Map.of());

    private final Map<String, List<String>> edges;

    private DependencyGraph(Map<String, List<String>> edges) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.edges = Collections.unmodifiableMap(copy);
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    /**
     * Copies the given mapping. Iteration order of {@code edges} becomes the
     * declaration order of the graph.
     */
    public static DependencyGraph of(Map<String, ? extends List<String>> edges) {
        Builder builder = builder();
        for (Map.Entry<String, ? extends List<String>> entry : edges.entrySet()) {
            builder.add(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> edgesOf(String packageName) {
        return edges.getOrDefault(packageName, List.of());
    }

    @Override
    public Set<String> packages() {
        return edges.keySet();
    }

    @Override
    public boolean contains(String packageName) {
        return edges.containsKey(packageName);
    }

    /**
     * Unmodifiable view of the underlying mapping.
     */
    public Map<String, List<String>> asMap() {
        return edges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyGraph)) return false;
        return edges.equals(((DependencyGraph) o).edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }

    /**
     * Collects edges in order. {@link #add(String, List)} declares a package once;
     * {@link #addEdge(String, String)} appends to an existing declaration.
     */
    public static final class Builder {

        private final Map<String, List<String>> edges = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String packageName, String... dependencies) {
            return add(packageName, Arrays.asList(dependencies));
        }

        /**
         * Declares {@code packageName} with its dependencies.
         *
         * @throws IllegalArgumentException if the package is already declared
         */
        public Builder add(String packageName, List<String> dependencies) {
            requireName(packageName);
            if (edges.containsKey(packageName)) {
                throw new IllegalArgumentException("Package declared twice: " + packageName);
            }
            List<String> list = new ArrayList<>();
            for (String dependency : dependencies) {
                requireName(dependency);
                list.add(dependency);
            }
            edges.put(packageName, list);
            return this;
        }

        /**
         * Appends one edge, declaring {@code packageName} if needed.
         */
        public Builder addEdge(String packageName, String dependency) {
            requireName(packageName);
            requireName(dependency);
            edges.computeIfAbsent(packageName, k -> new ArrayList<>()).add(dependency);
            return this;
        }

        public DependencyGraph build() {
            return edges.isEmpty() ? EMPTY : new DependencyGraph(edges);
        }

        private static void requireName(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Package name must be a non-empty string");
            }
        }
    }
}

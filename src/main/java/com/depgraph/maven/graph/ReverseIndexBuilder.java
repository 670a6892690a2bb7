package com.depgraph.maven.graph;

/**
 * Inverts a forward graph into a reverse index: each package maps to the
 * packages that directly depend on it.
 * <p>
 * The index is rebuilt on every call; nothing is cached.
 */
public final class ReverseIndexBuilder {

    /**
     * Builds the reverse index of {@code graph}. Packages are visited in declaration
     * order and their dependency lists in list order, so each dependents list is in
     * edge discovery order.
     *
     * @param graph forward graph
     * @return reverse index, empty for an empty graph
     */
    public static DependencyGraph buildReverseIndex(GraphSource graph) {
        DependencyGraph.Builder index = DependencyGraph.builder();
        for (String packageName : graph.packages()) {
            for (String dependency : graph.edgesOf(packageName)) {
                index.addEdge(dependency, packageName);
            }
        }
        return index.build();
    }

    private ReverseIndexBuilder() {
    }
}

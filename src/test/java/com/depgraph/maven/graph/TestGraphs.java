package com.depgraph.maven.graph;

/**
 * Graphs shared by the graph tests.
 */
final class TestGraphs {

    static DependencyGraph sample() {
        return DependencyGraph.builder()
                .add("A", "B", "C")
                .add("B", "D", "E")
                .add("C", "F", "G")
                .add("D", "H")
                .add("E", "H", "I")
                .add("F")
                .add("G", "I")
                .add("H")
                .add("I")
                .build();
    }

    static DependencyGraph cyclic() {
        return DependencyGraph.builder()
                .add("X", "Y")
                .add("Y", "Z")
                .add("Z", "X")
                .build();
    }

    private TestGraphs() {
    }
}

package com.depgraph.maven;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.depgraph.maven.graph.ClosureGraph;
import com.depgraph.maven.render.Direction;

/**
 * Everything one analysis produced. Optional parts are present only when the
 * request enabled them.
 */
public final class AnalysisResult {

    private final String packageName;
    private final Direction direction;
    private final ClosureGraph closure;
    private final Set<String> transitiveDependencies;
    private final Set<String> directDependents;
    private final String tree;
    private final String graphDescription;

    AnalysisResult(String packageName, Direction direction, ClosureGraph closure,
            Set<String> transitiveDependencies, Set<String> directDependents,
            String tree, String graphDescription) {
        this.packageName = packageName;
        this.direction = direction;
        this.closure = closure;
        this.transitiveDependencies = Collections.unmodifiableSet(new LinkedHashSet<>(transitiveDependencies));
        this.directDependents = Collections.unmodifiableSet(new LinkedHashSet<>(directDependents));
        this.tree = tree;
        this.graphDescription = graphDescription;
    }

    public String getPackageName() {
        return packageName;
    }

    public Direction getDirection() {
        return direction;
    }

    public ClosureGraph getClosure() {
        return closure;
    }

    /**
     * All packages reachable from the analyzed one (dependencies in forward mode,
     * dependents in reverse mode), in discovery order.
     */
    public Set<String> getTransitiveDependencies() {
        return transitiveDependencies;
    }

    /**
     * One-hop dependents; always empty in forward mode.
     */
    public Set<String> getDirectDependents() {
        return directDependents;
    }

    public Optional<String> getTree() {
        return Optional.ofNullable(tree);
    }

    public Optional<String> getGraphDescription() {
        return Optional.ofNullable(graphDescription);
    }
}

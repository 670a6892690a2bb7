package com.depgraph.maven.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when a traversal reaches a package that is already on its own
 * ancestor chain.
 */
public class CircularDependencyException extends Exception {

    private final String packageName;
    private final List<String> path;

    /**
     * @param packageName the package that was reached again
     * @param path        ancestor chain from the root up to, but not including,
     *                    the repeated visit
     */
    public CircularDependencyException(String packageName, List<String> path) {
        super(formatMessage(packageName, path));
        this.packageName = packageName;
        this.path = List.copyOf(path);
    }

    public String getPackageName() {
        return packageName;
    }

    public List<String> getPath() {
        return path;
    }

    /**
     * The full cycle as traversed: the ancestor chain followed by the repeated package.
     */
    public List<String> getCycle() {
        List<String> cycle = new ArrayList<>(path);
        cycle.add(packageName);
        return cycle;
    }

    private static String formatMessage(String packageName, List<String> path) {
        List<String> cycle = new ArrayList<>(path);
        cycle.add(packageName);
        return "Circular dependency: " + String.join(" -> ", cycle);
    }
}

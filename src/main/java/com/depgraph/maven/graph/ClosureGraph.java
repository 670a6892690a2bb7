package com.depgraph.maven.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of a single traversal: every package that was visited, mapped to the
 * direct references recorded for it, in the order they were first recorded.
 */
public final class ClosureGraph {

    private final Map<String, List<String>> entries;

    ClosureGraph(Map<String, List<String>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static ClosureGraph of(Map<String, List<String>> entries) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return new ClosureGraph(copy);
    }

    public boolean contains(String packageName) {
        return entries.containsKey(packageName);
    }

    /**
     * References recorded for a package, or an empty list if it was not visited.
     */
    public List<String> referencesOf(String packageName) {
        return entries.getOrDefault(packageName, List.of());
    }

    public Set<String> packages() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public Map<String, List<String>> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClosureGraph)) return false;
        return entries.equals(((ClosureGraph) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}

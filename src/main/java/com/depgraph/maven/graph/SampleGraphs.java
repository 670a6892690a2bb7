package com.depgraph.maven.graph;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * The two fixed graphs shipped with the plugin.
 * <ul>
 *   <li>{@link #normal()} - acyclic sample used for every analysis request;</li>
 *   <li>{@link #cyclic()} - small cycle used to exercise cycle detection.</li>
 * </ul>
 */
public final class SampleGraphs {

    public static final String NORMAL_RESOURCE = "/depgraph/graphs/sample.yaml";
    public static final String CYCLIC_RESOURCE = "/depgraph/graphs/cyclic.yaml";

    private static volatile DependencyGraph normal;
    private static volatile DependencyGraph cyclic;

    public static DependencyGraph normal() {
        if (normal == null) {
            normal = loadBundled(NORMAL_RESOURCE);
        }
        return normal;
    }

    public static DependencyGraph cyclic() {
        if (cyclic == null) {
            cyclic = loadBundled(CYCLIC_RESOURCE);
        }
        return cyclic;
    }

    // Bundled with the jar; a missing resource is a packaging error.
    private static DependencyGraph loadBundled(String resourcePath) {
        try {
            return GraphSourceLoader.loadFromResource(resourcePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Bundled graph could not be loaded: " + resourcePath, e);
        }
    }

    private SampleGraphs() {
    }
}

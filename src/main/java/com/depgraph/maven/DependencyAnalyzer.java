package com.depgraph.maven;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;

import com.depgraph.maven.config.AnalysisRequest;
import com.depgraph.maven.graph.CircularDependencyException;
import com.depgraph.maven.graph.ClosureGraph;
import com.depgraph.maven.graph.DependencyGraph;
import com.depgraph.maven.graph.DependencyResolver;
import com.depgraph.maven.graph.GraphSource;
import com.depgraph.maven.graph.ReverseDependencyResolver;
import com.depgraph.maven.graph.ReverseIndexBuilder;
import com.depgraph.maven.graph.SampleGraphs;
import com.depgraph.maven.graph.TransitiveSetCollector;
import com.depgraph.maven.render.Direction;
import com.depgraph.maven.render.GraphDescriptionExporter;
import com.depgraph.maven.render.TreeRenderer;

/**
 * Runs one {@link AnalysisRequest} against the configured graph sources.
 * <p>
 * The repository and test graph sources are injected separately so that a
 * repository-backed source can replace the static one without touching the
 * resolvers. The default wiring uses the same sample graph for both.
 */
public class DependencyAnalyzer {

    private final GraphSource repositoryGraph;
    private final GraphSource testGraph;
    private final GraphSource cyclicGraph;
    private final GraphDescriptionExporter exporter;
    private final Log log;

    public DependencyAnalyzer(GraphSource repositoryGraph, GraphSource testGraph, GraphSource cyclicGraph,
            GraphDescriptionExporter exporter, Log log) {
        this.repositoryGraph = repositoryGraph;
        this.testGraph = testGraph;
        this.cyclicGraph = cyclicGraph;
        this.exporter = exporter;
        this.log = log;
    }

    /**
     * Analyzer over the bundled sample graphs.
     */
    public static DependencyAnalyzer withSampleGraphs(GraphDescriptionExporter exporter, Log log) {
        DependencyGraph sample = SampleGraphs.normal();
        return new DependencyAnalyzer(sample, sample, SampleGraphs.cyclic(), exporter, log);
    }

    /**
     * Resolves the requested package and renders the enabled outputs.
     *
     * @throws CircularDependencyException if the requested package sits on a cycle
     * @throws IOException                 if the graph description cannot be rendered
     */
    public AnalysisResult analyze(AnalysisRequest request) throws CircularDependencyException, IOException {
        String packageName = request.getPackageName();
        GraphSource graph = request.isUseTestMode() ? testGraph : repositoryGraph;
        Direction direction = Direction.of(request.isReverseMode());
        log.debug("Resolving " + direction.getSuffix() + " dependencies of " + packageName
                + " over " + graph.packages().size() + " declared package(s)");

        ClosureGraph closure;
        Set<String> transitive;
        Set<String> directDependents;
        if (request.isReverseMode()) {
            DependencyGraph reverseIndex = ReverseIndexBuilder.buildReverseIndex(graph);
            closure = ReverseDependencyResolver.resolveReverse(reverseIndex, packageName);
            transitive = TransitiveSetCollector.allTransitiveDependencies(reverseIndex, packageName);
            directDependents = ReverseDependencyResolver.directReverseDependencies(reverseIndex, packageName);
        } else {
            closure = DependencyResolver.resolve(graph, packageName);
            transitive = TransitiveSetCollector.allTransitiveDependencies(graph, packageName);
            directDependents = Set.of();
        }

        if (!graph.contains(packageName)) {
            log.debug("Package " + packageName + " is not declared in the graph; treating it as a leaf");
        }

        String tree = request.isAsciiTreeEnabled() ? TreeRenderer.renderTree(closure, packageName) : null;
        String description = request.isGraphExportEnabled()
                ? exporter.exportGraph(closure, packageName, direction)
                : null;

        return new AnalysisResult(packageName, direction, closure, transitive, directDependents, tree, description);
    }

    /**
     * Resolves the cyclic graph from its first declared package to confirm that cycles are
     * detected. The detected cycle is returned rather than thrown.
     *
     * @return the detected cycle, or empty if the walk completed without finding one
     */
    public Optional<CircularDependencyException> checkCycleDetection() {
        Iterator<String> packages = cyclicGraph.packages().iterator();
        if (!packages.hasNext()) {
            return Optional.empty();
        }
        String start = packages.next();
        try {
            ClosureGraph closure = DependencyResolver.resolve(cyclicGraph, start);
            log.debug("No cycle reachable from " + start + " (" + closure.size() + " package(s) resolved)");
            return Optional.empty();
        } catch (CircularDependencyException e) {
            return Optional.of(e);
        }
    }

    /**
     * Writes a rendered graph description to {@code <outputDir>/<package>_<direction>.dot}.
     */
    public Path saveGraphDescription(AnalysisResult result, Path outputDir)
            throws IOException {
        String text = result.getGraphDescription()
                .orElseThrow(() -> new IllegalStateException("Graph export was not enabled for this analysis"));
        Path target = outputDir.resolve(
                GraphDescriptionExporter.fileName(result.getPackageName(), result.getDirection()));
        exporter.save(text, target);
        return target;
    }
}

package com.depgraph.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import com.depgraph.maven.config.AnalysisConfig;
import com.depgraph.maven.config.AnalysisConfigLoader;
import com.depgraph.maven.config.AnalysisRequest;
import com.depgraph.maven.config.ConfigException;
import com.depgraph.maven.config.ConfigFileNotFoundException;
import com.depgraph.maven.graph.CircularDependencyException;
import com.depgraph.maven.render.Direction;
import com.depgraph.maven.render.GraphDescriptionExporter;
import com.depgraph.maven.template.MustacheTemplateEngine;
import com.depgraph.maven.template.TemplateLoader;

/**
 * Analyzes the dependencies of the package named in the configuration file and
 * reports the closure, the transitive set, the ASCII tree and the DOT export.
 * <p>
 * Run manually: {@code mvn depgraph:analyze -Ddepgraph.configFile=depgraph.yaml}
 */
@Mojo(name = "analyze", requiresProject = false)
public class AnalyzeDependenciesMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    @Parameter(property = "depgraph.configFile", defaultValue = "${project.basedir}/depgraph.yaml")
    private File configFile;

    @Parameter(property = "depgraph.outputDir", defaultValue = "${project.basedir}")
    private File outputDir;

    @Parameter(property = "depgraph.templateDir")
    private File templateDir;

    @Parameter(property = "depgraph.cycleCheck", defaultValue = "true")
    private boolean cycleCheck;

    @Override
    public void execute() throws MojoExecutionException {
        AnalysisConfig config = loadConfig();
        displayParameters(config);

        AnalysisRequest request = config.toRequest();
        getLog().info("Analyzing package: " + request.getPackageName());
        getLog().info("Source: " + config.getRepositoryUrl());
        getLog().info("Test mode: " + (request.isUseTestMode() ? "enabled" : "disabled"));
        getLog().info("Direction: " + (request.isReverseMode() ? "reverse" : "forward"));
        getLog().info("Output format: " + (request.isAsciiTreeEnabled() ? "ASCII tree" : "standard"));

        Path userTemplateDir = (templateDir != null && templateDir.isDirectory()) ? templateDir.toPath() : null;
        TemplateLoader templateLoader = new TemplateLoader(userTemplateDir, getLog());
        GraphDescriptionExporter exporter = new GraphDescriptionExporter(new MustacheTemplateEngine(templateLoader));
        DependencyAnalyzer analyzer = DependencyAnalyzer.withSampleGraphs(exporter, getLog());

        AnalysisResult result;
        try {
            result = analyzer.analyze(request);
        } catch (CircularDependencyException e) {
            getLog().error(e.getMessage());
            throw new MojoExecutionException("Dependency analysis of " + request.getPackageName()
                    + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to render dependency graph for " + request.getPackageName(), e);
        }

        report(result);

        if (result.getGraphDescription().isPresent()) {
            try {
                Path saved = analyzer.saveGraphDescription(result, resolveOutputDir());
                getLog().info("Graph description saved to " + saved);
            } catch (IOException e) {
                throw new MojoExecutionException("Failed to save graph description", e);
            }
        }

        if (cycleCheck) {
            Optional<CircularDependencyException> cycle = analyzer.checkCycleDetection();
            if (cycle.isPresent()) {
                getLog().warn("Cycle detection check: " + cycle.get().getMessage());
            } else {
                getLog().info("Cycle detection check: no cycle found in the cyclic sample graph");
            }
        }
    }

    private AnalysisConfig loadConfig() throws MojoExecutionException {
        Path configPath = resolve(configFile, "depgraph.yaml");
        try {
            return AnalysisConfigLoader.load(configPath);
        } catch (ConfigFileNotFoundException e) {
            getLog().error(e.getMessage());
            getLog().info("Tip: run 'mvn depgraph:create-sample-config -Ddepgraph.configFile="
                    + e.getConfigPath() + "' to create a sample config");
            throw new MojoExecutionException("CONFIG ERROR: " + e.getMessage(), e);
        } catch (ConfigException e) {
            throw new MojoExecutionException("CONFIG ERROR: " + e.getMessage(), e);
        }
    }

    private void displayParameters(AnalysisConfig config) {
        getLog().info("=== Configuration Parameters ===");
        for (Map.Entry<String, Object> entry : config.getAllParameters().entrySet()) {
            getLog().info(entry.getKey() + ": " + entry.getValue());
        }
        getLog().info("================================");
    }

    private void report(AnalysisResult result) {
        String label = result.getDirection().getSuffix();
        getLog().info("=== Dependency graph (" + label + ") for " + result.getPackageName() + " ===");
        for (Map.Entry<String, List<String>> entry : result.getClosure().asMap().entrySet()) {
            List<String> references = entry.getValue();
            getLog().info("  " + entry.getKey() + " -> "
                    + (references.isEmpty() ? "(none)" : String.join(", ", references)));
        }

        Set<String> transitive = result.getTransitiveDependencies();
        String kind = result.getDirection() == Direction.REVERSE
                ? "Transitive dependents"
                : "Transitive dependencies";
        getLog().info(kind + " (" + transitive.size() + "): "
                + (transitive.isEmpty() ? "(none)" : String.join(", ", transitive)));

        if (result.getDirection() == Direction.REVERSE) {
            Set<String> direct = result.getDirectDependents();
            getLog().info("Direct dependents (" + direct.size() + "): "
                    + (direct.isEmpty() ? "(none)" : String.join(", ", direct)));
        }

        result.getTree().ifPresent(tree -> {
            getLog().info("ASCII tree:");
            for (String line : tree.split("\n")) {
                getLog().info(line);
            }
        });

        result.getGraphDescription().ifPresent(description -> {
            getLog().info("Graph description:");
            for (String line : description.split("\n")) {
                getLog().info(line);
            }
        });
    }

    private Path resolveOutputDir() {
        return resolve(outputDir, ".");
    }

    // Relative paths resolve against the project base directory when there is one.
    private Path resolve(File file, String fallback) {
        Path path = file != null ? file.toPath() : Path.of(fallback);
        if (path.isAbsolute() || project == null || project.getBasedir() == null) {
            return path;
        }
        return project.getBasedir().toPath().resolve(path);
    }
}

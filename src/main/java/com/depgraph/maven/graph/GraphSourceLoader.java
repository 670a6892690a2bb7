package com.depgraph.maven.graph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a static {@link DependencyGraph} from YAML.
 * <p>
 * Expected shape, one mapping entry per package in declaration order:
 * <pre>
 * "A": ["B", "C"]
 * "B": ["D"]
 * "D": []
 * </pre>
 */
public final class GraphSourceLoader {

    private static final Yaml yaml = new Yaml(loaderOptions());

    /**
     * Loads a graph from a YAML file.
     */
    public static DependencyGraph load(Path graphPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(graphPath)) {
            return parse(inputStream, graphPath.toString());
        }
    }

    /**
     * Loads a graph from a classpath resource.
     */
    public static DependencyGraph loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = GraphSourceLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return parse(inputStream, resourcePath);
        }
    }

    private static DependencyGraph parse(InputStream inputStream, String origin) throws IOException {
        Object data;
        try {
            data = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new IOException("Invalid graph YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (data == null) {
            return DependencyGraph.empty();
        }
        if (!(data instanceof Map)) {
            throw new IOException("Graph in " + origin + " must be a mapping of package to dependency list");
        }

        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
            String packageName = asPackageName(entry.getKey(), origin);
            builder.add(packageName, asDependencyList(packageName, entry.getValue(), origin));
        }
        return builder.build();
    }

    private static List<String> asDependencyList(String packageName, Object value, String origin)
            throws IOException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IOException("Dependencies of '" + packageName + "' in " + origin + " must be a list");
        }
        List<String> dependencies = new ArrayList<>();
        for (Object item : (List<?>) value) {
            dependencies.add(asPackageName(item, origin));
        }
        return dependencies;
    }

    private static String asPackageName(Object value, String origin) throws IOException {
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw new IOException("Invalid package name '" + value + "' in " + origin
                    + ": must be a non-empty string");
        }
        return (String) value;
    }

    private static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        // a package declared twice would silently lose the first list
        options.setAllowDuplicateKeys(false);
        return options;
    }

    private GraphSourceLoader() {
    }
}

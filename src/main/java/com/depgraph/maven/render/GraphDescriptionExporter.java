package com.depgraph.maven.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.depgraph.maven.graph.ClosureGraph;
import com.depgraph.maven.template.TemplateEngine;

/**
 * Exports a closure as a Graphviz DOT description through the
 * {@value #TEMPLATE} template.
 * <p>
 * Forward closures draw {@code package -> dependency}. Reverse closures map a package to its
 * dependents and draw {@code dependent -> package}, so an arrow always reads "requires".
 * Edges follow closure order then list order and are not deduplicated.
 */
public class GraphDescriptionExporter {

    static final String TEMPLATE = "graph.dot.mustache";

    private final TemplateEngine templateEngine;

    public GraphDescriptionExporter(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public String exportGraph(ClosureGraph closure, String root, Direction direction) throws IOException {
        Map<String, Object> context = new HashMap<>();
        context.put("graphName", quote(root));
        context.put("root", quote(root));
        context.put("rankdir", direction.getRankdir());
        context.put("edges", edges(closure, direction));
        return templateEngine.render(TEMPLATE, context);
    }

    /**
     * Writes {@code text} verbatim, replacing any existing file.
     *
     * @throws IOException if the file or its parent directory cannot be written
     */
    public void save(String text, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }

    /**
     * Output file name for an export: {@code <packageName>_<direction>.dot}.
     */
    public static String fileName(String packageName, Direction direction) {
        return packageName + "_" + direction.getSuffix() + ".dot";
    }

    private static List<Map<String, String>> edges(ClosureGraph closure, Direction direction) {
        List<Map<String, String>> edges = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : closure.asMap().entrySet()) {
            for (String reference : entry.getValue()) {
                Map<String, String> edge = new HashMap<>();
                if (direction == Direction.FORWARD) {
                    edge.put("from", quote(entry.getKey()));
                    edge.put("to", quote(reference));
                } else {
                    edge.put("from", quote(reference));
                    edge.put("to", quote(entry.getKey()));
                }
                edges.add(edge);
            }
        }
        return edges;
    }

    // Escapes for use inside a double-quoted DOT ID.
    static String quote(String id) {
        return id.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

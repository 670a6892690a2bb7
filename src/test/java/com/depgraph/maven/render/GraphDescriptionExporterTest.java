package com.depgraph.maven.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.depgraph.maven.graph.ClosureGraph;
import com.depgraph.maven.template.MustacheTemplateEngine;
import com.depgraph.maven.template.TemplateLoader;

class GraphDescriptionExporterTest {

    @TempDir
    Path tempDir;

    private GraphDescriptionExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new GraphDescriptionExporter(
                new MustacheTemplateEngine(new TemplateLoader(null, mock(Log.class))));
    }

    @Test
    void exportGraph_forward_drawsPackageToDependency() throws IOException {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("A", List.of("B", "C"));
        entries.put("B", List.of("C"));
        entries.put("C", List.of());

        String dot = exporter.exportGraph(ClosureGraph.of(entries), "A", Direction.FORWARD);

        assertThat(nonBlankLines(dot)).containsExactly(
                "digraph \"A\" {",
                "  rankdir=TB;",
                "  node [shape=box, style=rounded];",
                "  \"A\" [style=\"rounded,filled\", fillcolor=lightblue];",
                "  \"A\" -> \"B\";",
                "  \"A\" -> \"C\";",
                "  \"B\" -> \"C\";",
                "}");
    }

    @Test
    void exportGraph_reverse_drawsDependentToPackageBottomUp() throws IOException {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("H", List.of("D", "E"));
        entries.put("D", List.of("B"));

        String dot = exporter.exportGraph(ClosureGraph.of(entries), "H", Direction.REVERSE);

        assertThat(nonBlankLines(dot))
                .contains("  rankdir=BT;", "  \"H\" [style=\"rounded,filled\", fillcolor=lightblue];")
                .containsSubsequence("  \"D\" -> \"H\";", "  \"E\" -> \"H\";", "  \"B\" -> \"D\";");
    }

    @Test
    void exportGraph_duplicateReferences_areNotMerged() throws IOException {
        String dot = exporter.exportGraph(ClosureGraph.of(Map.of("A", List.of("B", "B"))), "A", Direction.FORWARD);

        assertThat(nonBlankLines(dot).stream().filter("  \"A\" -> \"B\";"::equals)).hasSize(2);
    }

    @Test
    void exportGraph_isolatedRoot_hasNoEdges() throws IOException {
        String dot = exporter.exportGraph(ClosureGraph.of(Map.of("solo", List.of())), "solo", Direction.FORWARD);

        assertThat(dot).doesNotContain("->").contains("\"solo\" [style=");
    }

    @Test
    void exportGraph_quotesAreEscaped() throws IOException {
        String dot = exporter.exportGraph(
                ClosureGraph.of(Map.of("a\"b", List.of("c\\d"))), "a\"b", Direction.FORWARD);

        assertThat(dot).contains("\"a\\\"b\" -> \"c\\\\d\";");
    }

    @Test
    void exportGraph_userTemplateOverridesBundledOne() throws IOException {
        Files.writeString(tempDir.resolve("graph.dot.mustache"), "custom {{{root}}} {{rankdir}}");
        GraphDescriptionExporter custom = new GraphDescriptionExporter(
                new MustacheTemplateEngine(new TemplateLoader(tempDir, mock(Log.class))));

        String dot = custom.exportGraph(ClosureGraph.of(Map.of("A", List.of())), "A", Direction.REVERSE);

        assertThat(dot).isEqualTo("custom A BT");
    }

    @Test
    void save_writesVerbatimAndOverwrites() throws IOException {
        Path target = tempDir.resolve("out/A_forward.dot");

        exporter.save("first version that is longer", target);
        exporter.save("digraph {}\n", target);

        assertThat(Files.readString(target)).isEqualTo("digraph {}\n");
    }

    @Test
    void save_unwritableLocation_throws() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThrows(IOException.class, () -> exporter.save("digraph {}", blocker.resolve("A_forward.dot")));
    }

    @Test
    void fileName_usesDirectionSuffix() {
        assertThat(GraphDescriptionExporter.fileName("A", Direction.FORWARD)).isEqualTo("A_forward.dot");
        assertThat(GraphDescriptionExporter.fileName("H", Direction.REVERSE)).isEqualTo("H_reverse.dot");
    }

    private static List<String> nonBlankLines(String text) {
        return text.lines().filter(line -> !line.isBlank()).collect(Collectors.toList());
    }
}

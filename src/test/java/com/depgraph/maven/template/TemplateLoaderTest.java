package com.depgraph.maven.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateLoaderTest {

    @Mock
    private Log log;

    @TempDir
    Path tempDir;

    @Test
    void loadTemplate_withoutUserDir_usesBundledTemplate() throws IOException {
        String template = new TemplateLoader(null, log).loadTemplate("graph.dot.mustache");

        assertThat(template).startsWith("digraph").contains("{{#edges}}");
        verify(log).debug("Using bundled template: /depgraph/templates/graph.dot.mustache");
    }

    @Test
    void loadTemplate_userDirWithoutTemplate_fallsBackToBundled() throws IOException {
        String template = new TemplateLoader(tempDir, log).loadTemplate("graph.dot.mustache");

        assertThat(template).startsWith("digraph");
    }

    @Test
    void loadTemplate_userTemplateWins() throws IOException {
        Files.writeString(tempDir.resolve("graph.dot.mustache"), "graph {}");

        assertThat(new TemplateLoader(tempDir, log).loadTemplate("graph.dot.mustache")).isEqualTo("graph {}");
    }

    @Test
    void loadTemplate_unknown_throws() {
        IOException e = assertThrows(IOException.class,
                () -> new TemplateLoader(tempDir, log).loadTemplate("missing.mustache"));

        assertThat(e.getMessage()).startsWith("Template not found: missing.mustache");
    }

    @Test
    void mustacheEngine_rendersSectionsWithoutEscaping() throws IOException {
        Files.writeString(tempDir.resolve("list.mustache"), "{{#items}}[{{{name}}}]{{/items}}");
        TemplateEngine engine = new MustacheTemplateEngine(new TemplateLoader(tempDir, log));

        String out = engine.render("list.mustache",
                Map.of("items", List.of(Map.of("name", "a&b"), Map.of("name", "\"c\""))));

        assertThat(out).isEqualTo("[a&b][\"c\"]");
    }
}

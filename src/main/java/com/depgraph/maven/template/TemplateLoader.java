package com.depgraph.maven.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;

/**
 * Loads templates with user override support.
 * Resolution order: user template directory, then the templates bundled under
 * {@value #CLASSPATH_ROOT}.
 */
public class TemplateLoader {

    static final String CLASSPATH_ROOT = "/depgraph/templates/";

    private final Path userTemplateDir;
    private final Log log;

    /**
     * @param userTemplateDir directory checked first, may be {@code null}
     * @param log             plugin log for resolution messages
     */
    public TemplateLoader(Path userTemplateDir, Log log) {
        this.userTemplateDir = userTemplateDir;
        this.log = log;
    }

    /**
     * Loads a template, trying the user directory first, then the bundled defaults.
     *
     * @param templatePath relative path to template (e.g., "graph.dot.mustache")
     * @return template content
     * @throws IOException if template cannot be found
     */
    public String loadTemplate(String templatePath) throws IOException {
        if (userTemplateDir != null) {
            Path userTemplate = userTemplateDir.resolve(templatePath);
            if (Files.isRegularFile(userTemplate)) {
                log.debug("Using user template: " + userTemplate);
                return Files.readString(userTemplate, StandardCharsets.UTF_8);
            }
        }

        String resourcePath = CLASSPATH_ROOT + templatePath;
        try (InputStream inputStream = TemplateLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream != null) {
                log.debug("Using bundled template: " + resourcePath);
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        throw new IOException("Template not found: " + templatePath
                + " (checked user: " + userTemplateDir + ", classpath: " + resourcePath + ")");
    }
}

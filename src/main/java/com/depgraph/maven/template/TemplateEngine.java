package com.depgraph.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Renders named text templates (DOT graph descriptions) against a context map.
 */
public interface TemplateEngine {
    /**
     * Renders a template with the given context.
     *
     * @param templateName template path relative to the template roots (e.g. "graph.dot.mustache")
     * @param context values referenced by the template
     * @return the rendered text
     * @throws IOException if the template cannot be found or rendered
     */
    String render(String templateName, Map<String, Object> context) throws IOException;
}

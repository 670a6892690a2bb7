package com.depgraph.maven.render;

import java.util.ArrayList;
import java.util.List;

import com.depgraph.maven.graph.ClosureGraph;

/**
 * Renders a closure as an indented ASCII tree:
 * <pre>
 * A
 * ├── B
 * │   └── D
 * └── C
 * </pre>
 * The closure must already be validated as acyclic by a resolver.
 */
public final class TreeRenderer {

    static final String BRANCH = "├── ";
    static final String CORNER = "└── ";
    static final String PIPE = "│   ";
    static final String BLANK = "    ";

    /**
     * @param closure validated closure
     * @param root    package printed on the first line
     * @return lines joined with {@code \n}, no trailing newline; just {@code root}
     *         if the closure does not contain it
     */
    public static String renderTree(ClosureGraph closure, String root) {
        if (!closure.contains(root)) {
            return root;
        }
        List<String> lines = new ArrayList<>();
        lines.add(root);
        renderChildren(closure, root, "", lines);
        return String.join("\n", lines);
    }

    private static void renderChildren(ClosureGraph closure, String node, String prefix, List<String> lines) {
        List<String> children = closure.referencesOf(node);
        for (int i = 0; i < children.size(); i++) {
            String child = children.get(i);
            boolean last = i == children.size() - 1;
            lines.add(prefix + (last ? CORNER : BRANCH) + child);
            renderChildren(closure, child, prefix + (last ? BLANK : PIPE), lines);
        }
    }

    private TreeRenderer() {
    }
}

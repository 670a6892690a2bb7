package com.depgraph.maven.render;

/**
 * Which way a closure was walked, and therefore how its edges are drawn.
 */
public enum Direction {
    /** Package to its dependencies, laid out top to bottom. */
    FORWARD("TB", "forward"),
    /** Package to its dependents, laid out bottom to top. */
    REVERSE("BT", "reverse");

    private final String rankdir;
    private final String suffix;

    Direction(String rankdir, String suffix) {
        this.rankdir = rankdir;
        this.suffix = suffix;
    }

    /** Graphviz {@code rankdir} value. */
    public String getRankdir() {
        return rankdir;
    }

    /** Lower-case name used in output file names. */
    public String getSuffix() {
        return suffix;
    }

    public static Direction of(boolean reverse) {
        return reverse ? REVERSE : FORWARD;
    }
}

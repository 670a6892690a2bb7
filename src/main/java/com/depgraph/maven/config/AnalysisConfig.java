package com.depgraph.maven.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated contents of the analysis configuration file.
 * <pre>
 * package_name: "A"
 * repository_url: "https://example.org/packages"
 * test_repository_mode: true
 * ascii_tree_output: true
 * reverse_mode: false      # optional
 * graph_export: true       # optional
 * </pre>
 * {@code repository_url} is informational; nothing is ever fetched from it.
 */
public class AnalysisConfig {

    public static final String PACKAGE_NAME = "package_name";
    public static final String REPOSITORY_URL = "repository_url";
    public static final String TEST_REPOSITORY_MODE = "test_repository_mode";
    public static final String ASCII_TREE_OUTPUT = "ascii_tree_output";
    public static final String REVERSE_MODE = "reverse_mode";
    public static final String GRAPH_EXPORT = "graph_export";

    private String packageName;
    private String repositoryUrl;
    private boolean testRepositoryMode;
    private boolean asciiTreeOutput;
    private boolean reverseMode;
    private boolean graphExport;

    public String getPackageName() {
        return packageName;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public void setRepositoryUrl(String repositoryUrl) {
        this.repositoryUrl = repositoryUrl;
    }

    public boolean isTestRepositoryMode() {
        return testRepositoryMode;
    }

    public void setTestRepositoryMode(boolean testRepositoryMode) {
        this.testRepositoryMode = testRepositoryMode;
    }

    public boolean isAsciiTreeOutput() {
        return asciiTreeOutput;
    }

    public void setAsciiTreeOutput(boolean asciiTreeOutput) {
        this.asciiTreeOutput = asciiTreeOutput;
    }

    public boolean isReverseMode() {
        return reverseMode;
    }

    public void setReverseMode(boolean reverseMode) {
        this.reverseMode = reverseMode;
    }

    public boolean isGraphExport() {
        return graphExport;
    }

    public void setGraphExport(boolean graphExport) {
        this.graphExport = graphExport;
    }

    public AnalysisRequest toRequest() {
        return new AnalysisRequest(packageName, testRepositoryMode, reverseMode, asciiTreeOutput, graphExport);
    }

    /**
     * All parameters in file order, for display.
     */
    public Map<String, Object> getAllParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(PACKAGE_NAME, packageName);
        params.put(REPOSITORY_URL, repositoryUrl);
        params.put(TEST_REPOSITORY_MODE, testRepositoryMode);
        params.put(ASCII_TREE_OUTPUT, asciiTreeOutput);
        params.put(REVERSE_MODE, reverseMode);
        params.put(GRAPH_EXPORT, graphExport);
        return params;
    }

    /**
     * Validates a parsed YAML document. Fields are checked in declaration order so the
     * first problem reported is the first one in the file format.
     */
    public static AnalysisConfig fromMap(Map<String, Object> map) throws ConfigException {
        AnalysisConfig config = new AnalysisConfig();
        config.setPackageName(requireNonBlankString(map, PACKAGE_NAME));
        config.setRepositoryUrl(requireNonBlankString(map, REPOSITORY_URL));
        config.setTestRepositoryMode(requireBoolean(map, TEST_REPOSITORY_MODE));
        config.setAsciiTreeOutput(requireBoolean(map, ASCII_TREE_OUTPUT));
        config.setReverseMode(optionalBoolean(map, REVERSE_MODE));
        config.setGraphExport(optionalBoolean(map, GRAPH_EXPORT));
        return config;
    }

    private static String requireNonBlankString(Map<String, Object> map, String field) throws ConfigException {
        if (!map.containsKey(field)) {
            throw new MissingConfigFieldException(field);
        }
        Object value = map.get(field);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new InvalidConfigException(field, value, "must be non-empty string");
        }
        return (String) value;
    }

    private static boolean requireBoolean(Map<String, Object> map, String field) throws ConfigException {
        if (!map.containsKey(field)) {
            throw new MissingConfigFieldException(field);
        }
        return asBoolean(field, map.get(field));
    }

    private static boolean optionalBoolean(Map<String, Object> map, String field) throws ConfigException {
        if (!map.containsKey(field)) {
            return false;
        }
        return asBoolean(field, map.get(field));
    }

    private static boolean asBoolean(String field, Object value) throws ConfigException {
        if (!(value instanceof Boolean)) {
            throw new InvalidConfigException(field, value, "must be boolean value");
        }
        return (Boolean) value;
    }
}

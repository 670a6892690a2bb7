package com.depgraph.maven.config;

import java.util.Objects;

/**
 * What to analyze and which outputs to produce. Built from an
 * {@link AnalysisConfig} and handed to the analyzer.
 */
public final class AnalysisRequest {

    private final String packageName;
    private final boolean useTestMode;
    private final boolean reverseMode;
    private final boolean asciiTreeEnabled;
    private final boolean graphExportEnabled;

    public AnalysisRequest(String packageName, boolean useTestMode, boolean reverseMode,
            boolean asciiTreeEnabled, boolean graphExportEnabled) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("Package name must be a non-empty string");
        }
        this.packageName = packageName;
        this.useTestMode = useTestMode;
        this.reverseMode = reverseMode;
        this.asciiTreeEnabled = asciiTreeEnabled;
        this.graphExportEnabled = graphExportEnabled;
    }

    public String getPackageName() {
        return packageName;
    }

    public boolean isUseTestMode() {
        return useTestMode;
    }

    public boolean isReverseMode() {
        return reverseMode;
    }

    public boolean isAsciiTreeEnabled() {
        return asciiTreeEnabled;
    }

    public boolean isGraphExportEnabled() {
        return graphExportEnabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisRequest)) return false;
        AnalysisRequest that = (AnalysisRequest) o;
        return useTestMode == that.useTestMode
                && reverseMode == that.reverseMode
                && asciiTreeEnabled == that.asciiTreeEnabled
                && graphExportEnabled == that.graphExportEnabled
                && packageName.equals(that.packageName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, useTestMode, reverseMode, asciiTreeEnabled, graphExportEnabled);
    }

    @Override
    public String toString() {
        return "AnalysisRequest{packageName=" + packageName
                + ", useTestMode=" + useTestMode
                + ", reverseMode=" + reverseMode
                + ", asciiTreeEnabled=" + asciiTreeEnabled
                + ", graphExportEnabled=" + graphExportEnabled + "}";
    }
}

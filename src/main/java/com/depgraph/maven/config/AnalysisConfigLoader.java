package com.depgraph.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link AnalysisConfig} from YAML files.
 */
public class AnalysisConfigLoader {

    /** Bundled sample written by {@code depgraph:create-sample-config}. */
    public static final String SAMPLE_RESOURCE = "/depgraph/sample-config.yaml";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads and validates configuration from a YAML file.
     */
    public static AnalysisConfig load(Path configPath) throws ConfigException {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigFileNotFoundException(configPath);
        }
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigException("Config file reading error: " + e.getMessage(), e);
        }
    }

    /**
     * Loads and validates configuration from a classpath resource.
     */
    public static AnalysisConfig loadFromResource(String resourcePath) throws ConfigException {
        try (InputStream inputStream = AnalysisConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new ConfigException("Resource not found: " + resourcePath);
            }
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigException("Config resource reading error: " + e.getMessage(), e);
        }
    }

    /**
     * Raw text of the bundled sample configuration.
     */
    public static String sampleConfig() throws IOException {
        try (InputStream inputStream = AnalysisConfigLoader.class.getResourceAsStream(SAMPLE_RESOURCE)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + SAMPLE_RESOURCE);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @SuppressWarnings("unchecked")
    private static AnalysisConfig parse(InputStream inputStream) throws ConfigException {
        Object data;
        try {
            data = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigException("YAML parsing error: " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new ConfigException("YAML parsing error: expected a mapping of settings but found "
                    + (data == null ? "an empty document" : data.getClass().getSimpleName()));
        }
        return AnalysisConfig.fromMap((Map<String, Object>) data);
    }
}

package com.depgraph.maven.config;

import java.nio.file.Path;

public class ConfigFileNotFoundException extends ConfigException {

    private final Path configPath;

    public ConfigFileNotFoundException(Path configPath) {
        super("Config file not found: " + configPath);
        this.configPath = configPath;
    }

    public Path getConfigPath() {
        return configPath;
    }
}

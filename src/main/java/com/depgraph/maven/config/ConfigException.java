package com.depgraph.maven.config;

/**
 * Base type for every problem with the analysis configuration file.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

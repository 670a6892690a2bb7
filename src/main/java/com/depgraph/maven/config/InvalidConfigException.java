package com.depgraph.maven.config;

public class InvalidConfigException extends ConfigException {

    private final String field;

    public InvalidConfigException(String field, Object value, String reason) {
        super("Invalid value '" + value + "' for field '" + field + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

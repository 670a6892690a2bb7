package com.depgraph.maven.config;

public class MissingConfigFieldException extends ConfigException {

    private final String field;

    public MissingConfigFieldException(String field) {
        super("Missing required config field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

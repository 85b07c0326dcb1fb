package com.taskweaver.core.model;

/**
 * Declared type of a tool or input parameter.
 */
public enum ParameterType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    DATETIME("string"),
    OBJECT("object"),
    ARRAY("array");

    private final String jsonType;

    ParameterType(String jsonType) {
        this.jsonType = jsonType;
    }

    /** JSON Schema type keyword used when advertising the parameter to a model. */
    public String jsonType() {
        return jsonType;
    }

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }
}

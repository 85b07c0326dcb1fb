package com.taskweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declares one parameter of a tool or of the delegate function.
 *
 * @param name             parameter name as the model sees it
 * @param description      human-readable description (nullable)
 * @param type             declared type
 * @param required         whether the key must be present
 * @param arrayElement     element description when {@code type} is ARRAY (nullable)
 * @param objectProperties nested properties when {@code type} is OBJECT
 */
public record ParameterSpec(
    String name,
    String description,
    ParameterType type,
    boolean required,
    ParameterSpec arrayElement,
    List<ParameterSpec> objectProperties
) implements Serializable {

    public ParameterSpec {
        type = type != null ? type : ParameterType.STRING;
        description = description != null ? description : "";
        objectProperties = objectProperties != null ? List.copyOf(objectProperties) : List.of();
    }

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return new ParameterSpec(name, description, type, true, null, List.of());
    }

    public static ParameterSpec optional(String name, ParameterType type, String description) {
        return new ParameterSpec(name, description, type, false, null, List.of());
    }
}

package com.taskweaver.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.ParameterType;

import java.util.List;

/**
 * Builds JSON Schema documents that describe tool parameters to a model.
 */
public final class ToolSchemas {

    private ToolSchemas() {}

    public static String inputSchema(ObjectMapper objectMapper, List<ParameterSpec> parameters) {
        return objectSchema(objectMapper, parameters).toString();
    }

    static ObjectNode objectSchema(ObjectMapper objectMapper, List<ParameterSpec> parameters) {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();
        for (ParameterSpec param : parameters) {
            properties.set(param.name(), propertySchema(objectMapper, param));
            if (param.required()) {
                required.add(param.name());
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private static ObjectNode propertySchema(ObjectMapper objectMapper, ParameterSpec param) {
        ObjectNode node;
        if (param.type() == ParameterType.OBJECT && !param.objectProperties().isEmpty()) {
            node = objectSchema(objectMapper, param.objectProperties());
        } else {
            node = objectMapper.createObjectNode();
            node.put("type", param.type().jsonType());
        }
        if (param.type() == ParameterType.DATETIME) {
            node.put("format", "date-time");
        }
        if (param.type() == ParameterType.ARRAY) {
            if (param.arrayElement() != null) {
                node.set("items", propertySchema(objectMapper, param.arrayElement()));
            } else {
                node.putObject("items");
            }
        }
        if (!param.description().isBlank()) {
            node.put("description", param.description());
        }
        return node;
    }
}

package com.taskweaver.core.validation;

import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.ParameterType;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks tool-call arguments against a declared parameter schema.
 * <p>
 * A required parameter is missing only when its key is absent; an explicit null
 * counts as present. A present non-null value is a type error when it is neither
 * of the declared type nor convertible to it: anything converts to a string,
 * numbers convert to each other, strings convert to numbers, booleans and
 * date-times. Objects and arrays are checked structurally only.
 */
public class ParameterValidator {

    public ValidationReport validate(List<ParameterSpec> schema, Map<String, Object> args) {
        List<String> missing = new ArrayList<>();
        List<String> typeErrors = new ArrayList<>();

        for (ParameterSpec param : schema) {
            if (!args.containsKey(param.name())) {
                if (param.required()) {
                    missing.add(param.name());
                }
                continue;
            }
            Object value = args.get(param.name());
            if (value != null && !isCompatible(value, param.type())) {
                typeErrors.add("Parameter '" + param.name() + "' expected type "
                        + param.type().name().toLowerCase(Locale.ROOT) + " but got " + value.getClass().getSimpleName());
            }
        }
        return new ValidationReport(missing, typeErrors);
    }

    static boolean isCompatible(Object value, ParameterType type) {
        return switch (type) {
            case STRING -> true;
            case NUMBER, INTEGER -> value instanceof Number || value instanceof String;
            case BOOLEAN -> value instanceof Boolean || value instanceof String;
            case DATETIME -> value instanceof TemporalAccessor || value instanceof Date || value instanceof String;
            case OBJECT -> value instanceof Map;
            case ARRAY -> value instanceof Collection || value.getClass().isArray();
        };
    }
}

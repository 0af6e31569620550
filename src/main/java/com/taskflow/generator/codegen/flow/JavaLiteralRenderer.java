package com.taskflow.generator.codegen.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.github.javaparser.utils.StringEscapeUtils;
import com.taskflow.generator.codegen.exception.ValidationException;

/**
 * Renders flow parameters as Java source literals.
 */
public class JavaLiteralRenderer {

    /**
     * A {@code Map<String, Object>} expression holding the given entries in order.
     *
     * @throws ValidationException listing every key whose value has no literal form
     */
    public String renderMap(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return "Map.of()";
        }
        List<String> entries = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, Object> param : params.entrySet()) {
            if (param.getKey() == null) {
                errors.add("Parameter names must not be null");
                continue;
            }
            try {
                entries.add("Map.entry(" + string(param.getKey()) + ", " + render(param.getValue()) + ")");
            } catch (ValidationException e) {
                errors.add("Parameter '" + param.getKey() + "': " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return "Map.ofEntries(" + String.join(", ", entries) + ")";
    }

    public String render(Object value) {
        if (value == null) {
            throw new ValidationException("null values cannot be passed to a flow");
        }
        if (value instanceof String) {
            return string((String) value);
        }
        if (value instanceof Character) {
            return "'" + StringEscapeUtils.escapeJava(value.toString()).replace("'", "\\'") + "'";
        }
        if (value instanceof Boolean || value instanceof Integer) {
            return value.toString();
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Short) {
            return "(short) " + value;
        }
        if (value instanceof Byte) {
            return "(byte) " + value;
        }
        if (value instanceof Double) {
            return doubleLiteral((Double) value);
        }
        if (value instanceof Float) {
            return floatLiteral((Float) value);
        }
        throw new ValidationException("unsupported value type " + value.getClass().getName());
    }

    private static String string(String value) {
        return "\"" + StringEscapeUtils.escapeJava(value) + "\"";
    }

    private static String doubleLiteral(double value) {
        if (Double.isNaN(value)) {
            throw new ValidationException("NaN cannot be passed to a flow");
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        return Double.toString(value);
    }

    private static String floatLiteral(float value) {
        if (Float.isNaN(value)) {
            throw new ValidationException("NaN cannot be passed to a flow");
        }
        if (Float.isInfinite(value)) {
            return value > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
        }
        return value + "f";
    }
}

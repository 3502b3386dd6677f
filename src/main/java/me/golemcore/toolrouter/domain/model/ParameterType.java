package me.golemcore.toolrouter.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a pattern input parameter.
 */
public enum ParameterType {
    STRING, INTEGER, NUMBER, BOOLEAN, ARRAY, OBJECT;

    @JsonCreator
    public static ParameterType fromValue(String value) {
        return ParameterType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether a decoded JSON value is acceptable for this type. Integral
     * strings are accepted for numeric types since many callers send form-encoded
     * values.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
        case STRING -> value instanceof String;
        case INTEGER -> value instanceof Integer || value instanceof Long
                || (value instanceof String s && s.matches("-?\\d+"));
        case NUMBER -> value instanceof Number
                || (value instanceof String s && s.matches("-?\\d+(\\.\\d+)?"));
        case BOOLEAN -> value instanceof Boolean
                || (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")));
        case ARRAY -> value instanceof Collection<?> || value instanceof Object[] || value instanceof List<?>;
        case OBJECT -> value instanceof Map<?, ?>;
        };
    }
}

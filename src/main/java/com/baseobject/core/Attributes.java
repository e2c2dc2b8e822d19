package com.baseobject.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named construction values, written as alternating names and values:
 * {@code new Person(Attributes.of("name", "Alice", "age", 30))}.
 */
public final class Attributes {

    private Attributes() {
        // Utility class
    }

    public static Map<String, Object> of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Argument " + i + " must be a field name, got " + namesAndValues[i]);
            }
            values.put(name, namesAndValues[i + 1]);
        }
        return values;
    }
}

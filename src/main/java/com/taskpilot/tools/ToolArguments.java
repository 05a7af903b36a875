package com.taskpilot.tools;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over validated tool parameters.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String string(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value == null ? "" : value.toString();
    }

    @Nullable
    public static String optionalString(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public static int integer(Map<String, Object> parameters, String name, int fallback) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return fallback;
    }

    public static List<String> strings(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(item -> values.add(String.valueOf(item)));
        } else if (value instanceof Object[] array) {
            Arrays.stream(array).forEach(item -> values.add(String.valueOf(item)));
        } else {
            values.add(value.toString());
        }
        return values;
    }
}

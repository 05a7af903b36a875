package com.taskpilot.tools;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

public enum ParameterType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof Collection<?> || value.getClass().isArray();
            case OBJECT -> value instanceof Map<?, ?>;
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

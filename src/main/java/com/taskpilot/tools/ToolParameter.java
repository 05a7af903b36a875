package com.taskpilot.tools;

import org.springframework.lang.Nullable;

public record ToolParameter(
        String name,
        ParameterType type,
        String description,
        boolean required,
        @Nullable Object defaultValue
) {

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, description, true, null);
    }

    public static ToolParameter optional(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, description, false, null);
    }

    public static ToolParameter optional(String name, ParameterType type, String description, Object defaultValue) {
        return new ToolParameter(name, type, description, false, defaultValue);
    }
}

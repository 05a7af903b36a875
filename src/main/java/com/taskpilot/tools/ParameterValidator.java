package com.taskpilot.tools;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks call parameters against a tool's declared schema.
 */
final class ParameterValidator {

    private ParameterValidator() {
    }

    static Validation validate(ToolDescriptor tool, @Nullable Map<String, Object> parameters) {
        Map<String, Object> incoming = parameters == null ? Map.of() : parameters;
        List<String> problems = new ArrayList<>();
        Set<String> declared = tool.parameters().stream()
                .map(ToolParameter::name)
                .collect(Collectors.toSet());

        for (String key : incoming.keySet()) {
            if (!declared.contains(key)) {
                problems.add("unknown parameter '" + key + "'");
            }
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ToolParameter parameter : tool.parameters()) {
            Object value = incoming.get(parameter.name());
            if (value == null) {
                if (parameter.required()) {
                    problems.add("missing required parameter '" + parameter.name() + "'");
                } else if (parameter.defaultValue() != null) {
                    resolved.put(parameter.name(), parameter.defaultValue());
                }
                continue;
            }
            if (!parameter.type().accepts(value)) {
                problems.add("parameter '" + parameter.name() + "' must be of type " + parameter.type().label());
                continue;
            }
            resolved.put(parameter.name(), value);
        }

        if (!problems.isEmpty()) {
            return new Validation(null, "Invalid parameters for tool \"" + tool.name() + "\": "
                    + String.join("; ", problems));
        }
        return new Validation(Collections.unmodifiableMap(resolved), null);
    }

    record Validation(@Nullable Map<String, Object> parameters, @Nullable String error) {

        boolean valid() {
            return error == null;
        }
    }
}

package com.taskpilot.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

/**
 * Outcome of a single tool invocation. Failures are carried as data so callers never
 * need to catch anything coming out of {@link ToolRegistry#execute}.
 *
 * @param rejected true when the call was refused before the handler ran (unknown tool or
 *                 parameters that do not match the schema)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        boolean success,
        String output,
        @Nullable Object data,
        @Nullable String error,
        boolean rejected
) {

    public static ToolResult success(String output) {
        return new ToolResult(true, output == null ? "" : output, null, null, false);
    }

    public static ToolResult success(String output, @Nullable Object data) {
        return new ToolResult(true, output == null ? "" : output, data, null, false);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, "", null, error, false);
    }

    public static ToolResult rejected(String error) {
        return new ToolResult(false, "", null, error, true);
    }
}

package com.taskpilot.tools;

import java.util.Map;

/**
 * Capability behind a tool name. Handlers receive parameters that already passed schema
 * validation, with declared defaults filled in.
 */
@FunctionalInterface
public interface ToolHandler {

    ToolResult handle(Map<String, Object> parameters) throws Exception;
}

package com.taskpilot.tools;

/**
 * Raised by handlers when the underlying operation cannot be carried out.
 * The registry turns it into a failed {@link ToolResult}.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.taskpilot.agent;

public enum FailureKind {
    /** Unknown or disallowed tool, or parameters that do not match the schema. */
    VALIDATION,
    /** The tool ran and reported a failure. */
    EXECUTION,
    /** Approval was denied or timed out. */
    DENIED,
    CANCELLED
}

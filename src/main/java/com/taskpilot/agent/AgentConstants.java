package com.taskpilot.agent;

public final class AgentConstants {

    private AgentConstants() {
    }

    public static final String STEP_ID_PREFIX = "step-";

    public static final String DENIED_BY_USER = "denied by user";
    public static final String APPROVAL_TIMED_OUT = "approval timed out";
    public static final String CANCELLED = "cancelled";
    public static final String TOOL_NOT_ALLOWED = "Tool \"%s\" is not allowed for this task";

    public static final String PLANNER_FAILED = "Planning failed.";
    public static final String TASK_CANCELLED = "Task cancelled.";
    public static final String NO_RESPONSE = "Task finished without a response.";
    public static final String STEP_SUMMARY = "Completed %d steps, %d failed.";
    public static final String ROUND_CAP_SUMMARY = "Stopped after %d rounds. " + STEP_SUMMARY;
}

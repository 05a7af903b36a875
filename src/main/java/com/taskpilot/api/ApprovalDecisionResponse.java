package com.taskpilot.api;

/**
 * @param accepted false when the step had no pending approval or was already decided
 */
public record ApprovalDecisionResponse(
        boolean accepted
) {
}

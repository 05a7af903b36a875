package com.taskpilot.agent;

/**
 * Result of one task run.
 *
 * @param plan every step from every round, plus the last conversational response
 * @param finalOutput the answer shown to the user, or the reason the run stopped
 * @param success false when the planner failed or the run was cancelled
 */
public record TaskOutcome(
        Plan plan,
        String finalOutput,
        int rounds,
        int stepsCompleted,
        int stepsFailed,
        boolean success
) {
}

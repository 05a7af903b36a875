package com.taskpilot.agent;

/**
 * Lifecycle of a plan step. Transitions only move forward; the single skip is
 * {@code PENDING -> FAILED} when approval is denied.
 */
public enum StepStatus {
    PENDING,
    APPROVED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(StepStatus next) {
        return switch (this) {
            case PENDING -> next == APPROVED || next == FAILED;
            case APPROVED -> next == EXECUTING;
            case EXECUTING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}

package com.taskpilot.approval;

public enum ApprovalDecision {
    APPROVED,
    DENIED,
    TIMED_OUT,
    CANCELLED;

    public boolean approved() {
        return this == APPROVED;
    }
}

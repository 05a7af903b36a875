package com.taskpilot.approval;

public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH;

    public boolean requiresApproval() {
        return this != LOW;
    }
}

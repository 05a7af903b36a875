package com.taskpilot.api;

import jakarta.validation.constraints.NotNull;

public record ApprovalDecisionRequest(
        @NotNull Boolean approved
) {
}

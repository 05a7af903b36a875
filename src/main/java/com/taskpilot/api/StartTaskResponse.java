package com.taskpilot.api;

import java.time.Instant;

public record StartTaskResponse(
        String runId,
        Instant createdAt
) {
}

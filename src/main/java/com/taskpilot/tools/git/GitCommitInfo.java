package com.taskpilot.tools.git;

import java.time.Instant;

public record GitCommitInfo(
        String oid,
        String message,
        String author,
        Instant timestamp
) {
}

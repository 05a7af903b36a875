package com.taskpilot.stream;

import java.time.Instant;

/**
 * One buffered event of a run. Ids increase per run so clients can resume with {@code since}.
 */
public record StreamEvent(
        long id,
        Instant timestamp,
        String type,
        Object data
) {
}

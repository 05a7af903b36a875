package com.taskpilot.planner;

/**
 * A user-defined model served by any OpenAI-compatible endpoint.
 */
public record ModelEntry(
        String id,
        String name,
        String endpoint,
        String apiKey
) {
}

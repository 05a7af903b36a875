package com.taskpilot.planner;

/**
 * Where a planning request for a model is sent.
 */
public record ModelRoute(
        String modelId,
        String baseUrl,
        String completionsPath,
        String apiKey,
        String source
) {

    @Override
    public String toString() {
        return "ModelRoute[" + modelId + " -> " + baseUrl + completionsPath + " via " + source + "]";
    }
}

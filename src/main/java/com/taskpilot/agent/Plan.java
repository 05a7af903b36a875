package com.taskpilot.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * The ordered steps proposed for a goal, or a plain-text answer when no tools are needed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Plan(
        String goal,
        List<Step> steps,
        @Nullable String conversationalResponse
) {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Plan conversational(String goal, String response) {
        return new Plan(goal, List.of(), response);
    }

    public boolean isConversational() {
        return steps.isEmpty();
    }

    public Plan snapshot() {
        return new Plan(goal, steps.stream().map(Step::copy).toList(), conversationalResponse);
    }
}

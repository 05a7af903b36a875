package com.taskpilot.planner;

import com.taskpilot.agent.Step;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Input of one planning round.
 *
 * @param stepHistory copies of every step executed in earlier rounds
 */
public record PlanRequest(
        String goal,
        List<ChatTurn> conversation,
        List<Step> stepHistory,
        List<String> allowedTools,
        @Nullable String modelId,
        List<ModelEntry> customModels,
        @Nullable String apiKey,
        int round
) {

    public PlanRequest {
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
        stepHistory = stepHistory == null ? List.of() : List.copyOf(stepHistory);
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        customModels = customModels == null ? List.of() : List.copyOf(customModels);
    }
}

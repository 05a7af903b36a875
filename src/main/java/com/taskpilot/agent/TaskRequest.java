package com.taskpilot.agent;

import com.taskpilot.planner.ChatTurn;
import com.taskpilot.planner.ModelEntry;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * @param allowedTools tools the planner may use; empty means the configured defaults
 * @param modelId model to plan with; null means the configured default model
 */
public record TaskRequest(
        String goal,
        List<String> allowedTools,
        @Nullable String modelId,
        List<ModelEntry> customModels,
        @Nullable String apiKey,
        List<ChatTurn> conversation
) {

    public TaskRequest {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        customModels = customModels == null ? List.of() : List.copyOf(customModels);
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
    }

    public static TaskRequest of(String goal, List<String> allowedTools) {
        return new TaskRequest(goal, allowedTools, null, List.of(), null, List.of());
    }
}

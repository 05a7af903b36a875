package com.taskpilot.api;

import com.taskpilot.agent.TaskRequest;
import com.taskpilot.planner.ChatTurn;
import com.taskpilot.planner.ModelEntry;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record StartTaskRequest(
        @NotBlank String goal,
        List<String> allowedTools,
        String model,
        String apiKey,
        List<ModelEntry> customModels,
        List<ChatTurn> history
) {

    public TaskRequest toTaskRequest() {
        return new TaskRequest(goal.trim(), allowedTools, model, customModels, apiKey, history);
    }
}

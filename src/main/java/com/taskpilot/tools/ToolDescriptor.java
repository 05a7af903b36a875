package com.taskpilot.tools;

import com.taskpilot.approval.RiskClassifier;
import com.taskpilot.approval.RiskTier;

import java.util.List;

public record ToolDescriptor(
        String name,
        String description,
        RiskTier riskTier,
        List<ToolParameter> parameters,
        ToolHandler handler
) {

    public ToolDescriptor {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Builds a descriptor whose tier comes from the static risk table.
     */
    public static ToolDescriptor of(String name, String description, List<ToolParameter> parameters,
                                    ToolHandler handler) {
        return new ToolDescriptor(name, description, RiskClassifier.classify(name), parameters, handler);
    }
}

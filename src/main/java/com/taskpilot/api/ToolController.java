package com.taskpilot.api;

import com.taskpilot.approval.RiskTier;
import com.taskpilot.tools.ToolParameter;
import com.taskpilot.tools.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolSummary> listTools() {
        return toolRegistry.listTools().stream()
                .map(tool -> new ToolSummary(tool.name(), tool.description(), tool.riskTier(), tool.parameters()))
                .toList();
    }

    public record ToolSummary(String name, String description, RiskTier riskTier, List<ToolParameter> parameters) {}
}

package com.taskpilot.tools;

import com.taskpilot.approval.RiskTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dispatch table from tool name to validated, side-effecting handler.
 * The table is filled once from every {@link ToolProvider} bean and never changes afterwards.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolDescriptor> tools;
    private final ToolCallAudit audit = new ToolCallAudit();

    public ToolRegistry(List<ToolProvider> providers) {
        Map<String, ToolDescriptor> registered = new LinkedHashMap<>();
        for (ToolProvider provider : providers) {
            for (ToolDescriptor tool : provider.tools()) {
                if (registered.putIfAbsent(tool.name(), tool) != null) {
                    throw new IllegalStateException("Duplicate tool registration: " + tool.name());
                }
            }
        }
        this.tools = Collections.unmodifiableMap(registered);
        log.info("Registered {} tools: {}", tools.size(), String.join(", ", tools.keySet()));
    }

    /**
     * Runs the named tool. Never throws: unknown tools, schema mismatches and handler
     * failures all come back as an unsuccessful {@link ToolResult}.
     */
    public ToolResult execute(String name, @Nullable Map<String, Object> parameters) {
        ToolDescriptor tool = StringUtils.hasText(name) ? tools.get(name) : null;
        if (tool == null) {
            ToolResult result = ToolResult.rejected("Tool \"" + name + "\" not found");
            audit.recordCall(String.valueOf(name), parameters, result);
            return result;
        }
        ParameterValidator.Validation validation = ParameterValidator.validate(tool, parameters);
        if (!validation.valid()) {
            ToolResult result = ToolResult.rejected(validation.error());
            audit.recordCall(name, parameters, result);
            return result;
        }
        ToolResult result;
        try {
            result = tool.handler().handle(validation.parameters());
            if (result == null) {
                result = ToolResult.failure("Tool \"" + name + "\" returned no result");
            }
        } catch (Exception ex) {
            result = ToolResult.failure(describe(ex));
        }
        audit.recordCall(name, parameters, result);
        return result;
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Collection<ToolDescriptor> listTools() {
        return tools.values();
    }

    public List<String> toolNames() {
        return List.copyOf(tools.keySet());
    }

    public RiskTier riskTier(String name) {
        ToolDescriptor tool = tools.get(name);
        return tool == null ? RiskTier.LOW : tool.riskTier();
    }

    /**
     * Renders the catalogue of the given tools for a planning prompt.
     */
    public String describe(Collection<String> allowedNames) {
        return tools.values().stream()
                .filter(tool -> allowedNames.contains(tool.name()))
                .map(this::describeTool)
                .collect(Collectors.joining("\n\n"));
    }

    private String describeTool(ToolDescriptor tool) {
        String params = tool.parameters().isEmpty()
                ? "  (none)"
                : tool.parameters().stream()
                .map(p -> "  - " + p.name() + ": " + p.type().label()
                        + (p.required() ? " (required)" : " (optional)")
                        + " - " + p.description())
                .collect(Collectors.joining("\n"));
        return "## " + tool.name() + "\n" + tool.description() + "\nParameters:\n" + params;
    }

    private String describe(Exception ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }
}

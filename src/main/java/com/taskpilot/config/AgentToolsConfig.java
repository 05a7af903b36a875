package com.taskpilot.config;

import java.util.*;

/**
 * Tool access defaults applied when a task request does not name its allowed tools.
 */
public class AgentToolsConfig {

    /**
     * Tool names allowed by default. When empty every registered tool is allowed.
     */
    private List<String> defaultAllowed = new ArrayList<>();

    public AgentToolsConfig() {}

    public List<String> getDefaultAllowed() { return defaultAllowed; }
    public void setDefaultAllowed(List<String> defaultAllowed) { this.defaultAllowed = defaultAllowed != null ? defaultAllowed : new ArrayList<>(); }

    /**
     * Resolve the allowed tool names for a request, falling back to configured defaults and then to all registered tools.
     */
    public List<String> resolveAllowed(List<String> requested, Collection<String> registered) {
        List<String> source = normalize(requested);
        if (source.isEmpty()) {
            source = normalize(defaultAllowed);
        }
        if (source.isEmpty()) {
            return List.copyOf(registered);
        }
        return source;
    }

    private List<String> normalize(List<String> names) {
        if (names == null) {
            return List.of();
        }
        // ensure distinct order-preserving
        return names.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT)).distinct().toList();
    }
}

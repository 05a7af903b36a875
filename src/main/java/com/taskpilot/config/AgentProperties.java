package com.taskpilot.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private int maxRounds = 8;
    private String workspaceRoot;
    private Duration approvalTimeout = Duration.ofMinutes(15);
    private Duration plannerTimeout = Duration.ofSeconds(120);
    private String defaultModel = "gpt-4o-mini";
    private String npmRegistryUrl = "https://registry.npmjs.org";
    private int searchMaxResults = 200;
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    private AgentToolsConfig tools = new AgentToolsConfig();
    private GitConfig git = new GitConfig();
    private List<ProviderConfig> providers = new ArrayList<>(List.of(
            new ProviderConfig("openai", List.of("gpt", "o1", "o3", "o4"), "https://api.openai.com", "/v1/chat/completions"),
            new ProviderConfig("anthropic", List.of("claude", "anthropic"), "https://api.anthropic.com", "/v1/chat/completions"),
            new ProviderConfig("google", List.of("gemini"), "https://generativelanguage.googleapis.com/v1beta/openai", "/chat/completions")));
    private List<ModelInfo> models = new ArrayList<>(List.of(
            new ModelInfo("claude-3.5-sonnet", "Claude 3.5 Sonnet", "Anthropic", "Most capable model for complex tasks"),
            new ModelInfo("claude-3-haiku", "Claude 3 Haiku", "Anthropic", "Fast and lightweight"),
            new ModelInfo("gpt-4o", "GPT-4o", "OpenAI", "OpenAI's flagship model"),
            new ModelInfo("gpt-4o-mini", "GPT-4o Mini", "OpenAI", "Fast and cost-effective")));

    /**
     * An OpenAI-compatible chat endpoint serving every model id that starts with one of its prefixes.
     */
    public static class ProviderConfig {
        private String name;
        private List<String> modelPrefixes = new ArrayList<>();
        private String baseUrl;
        private String completionsPath = "/v1/chat/completions";
        private String apiKey;

        public ProviderConfig() {}

        public ProviderConfig(String name, List<String> modelPrefixes, String baseUrl, String completionsPath) {
            this.name = name;
            this.modelPrefixes = new ArrayList<>(modelPrefixes);
            this.baseUrl = baseUrl;
            this.completionsPath = completionsPath;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getModelPrefixes() { return modelPrefixes; }
        public void setModelPrefixes(List<String> modelPrefixes) { this.modelPrefixes = modelPrefixes != null ? modelPrefixes : new ArrayList<>(); }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getCompletionsPath() { return completionsPath; }
        public void setCompletionsPath(String completionsPath) { this.completionsPath = completionsPath; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean serves(String modelId) {
            if (modelId == null) {
                return false;
            }
            String normalized = modelId.toLowerCase(Locale.ROOT);
            return modelPrefixes.stream()
                    .filter(prefix -> prefix != null && !prefix.isBlank())
                    .anyMatch(prefix -> normalized.startsWith(prefix.toLowerCase(Locale.ROOT)));
        }
    }

    public record ModelInfo(String id, String name, String provider, String description) {}

    public static class GitConfig {
        private String authorName = "TaskPilot";
        private String authorEmail = "taskpilot@localhost";
        /**
         * Credentials for clone, pull and push when a call does not pass its own.
         */
        private String username;
        private String token;

        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public void setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public void setApprovalTimeout(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }

    public Duration getPlannerTimeout() {
        return plannerTimeout;
    }

    public void setPlannerTimeout(Duration plannerTimeout) {
        this.plannerTimeout = plannerTimeout;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String getNpmRegistryUrl() {
        return npmRegistryUrl;
    }

    public void setNpmRegistryUrl(String npmRegistryUrl) {
        this.npmRegistryUrl = npmRegistryUrl;
    }

    public int getSearchMaxResults() {
        return searchMaxResults;
    }

    public void setSearchMaxResults(int searchMaxResults) {
        this.searchMaxResults = searchMaxResults;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins != null ? allowedOrigins : new ArrayList<>();
    }

    public AgentToolsConfig getTools() {
        return tools;
    }

    public void setTools(AgentToolsConfig tools) {
        this.tools = tools != null ? tools : new AgentToolsConfig();
    }

    public GitConfig getGit() {
        return git;
    }

    public void setGit(GitConfig git) {
        this.git = git != null ? git : new GitConfig();
    }

    public List<ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderConfig> providers) {
        if (providers == null || providers.isEmpty()) {
            return;
        }
        this.providers = new ArrayList<>(providers);
    }

    public List<ModelInfo> getModels() {
        return models;
    }

    public void setModels(List<ModelInfo> models) {
        if (models == null || models.isEmpty()) {
            return;
        }
        this.models = new ArrayList<>(models);
    }
}

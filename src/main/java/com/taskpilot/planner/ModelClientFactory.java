package com.taskpilot.planner;

import com.taskpilot.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a chat model for the requested model id. Every provider is reached through the
 * OpenAI chat-completions protocol; user-defined models take precedence over configured providers.
 */
@Component
@Slf4j
public class ModelClientFactory {

    private static final String CHAT_COMPLETIONS = "/chat/completions";
    private static final Pattern VERSION_SUFFIX = Pattern.compile(".*/v\\d+$");

    private final AgentProperties properties;
    private final ObjectProvider<RestClient.Builder> restClientBuilder;
    private final ObjectProvider<WebClient.Builder> webClientBuilder;

    public ModelClientFactory(AgentProperties properties,
                              ObjectProvider<RestClient.Builder> restClientBuilder,
                              ObjectProvider<WebClient.Builder> webClientBuilder) {
        this.properties = properties;
        this.restClientBuilder = restClientBuilder;
        this.webClientBuilder = webClientBuilder;
    }

    public ChatModel create(@Nullable String modelId, List<ModelEntry> customModels, @Nullable String apiKey)
            throws PlannerException {
        ModelRoute route = resolve(modelId, customModels, apiKey);
        log.debug("Routing planner request: {}", route);
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(route.baseUrl())
                .completionsPath(route.completionsPath())
                .apiKey(route.apiKey())
                .restClientBuilder(restClientBuilder.getIfAvailable(RestClient::builder))
                .webClientBuilder(webClientBuilder.getIfAvailable(WebClient::builder))
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(route.modelId()).build())
                .build();
    }

    public ModelRoute resolve(@Nullable String modelId, @Nullable List<ModelEntry> customModels,
                              @Nullable String apiKey) throws PlannerException {
        String model = StringUtils.hasText(modelId) ? modelId.trim() : properties.getDefaultModel();
        if (!StringUtils.hasText(model)) {
            throw new PlannerException("No model selected.");
        }
        if (customModels != null) {
            for (ModelEntry entry : customModels) {
                if (entry != null && model.equals(entry.id())) {
                    return customRoute(entry, apiKey);
                }
            }
        }
        for (AgentProperties.ProviderConfig provider : properties.getProviders()) {
            if (provider.serves(model)) {
                String key = StringUtils.hasText(apiKey) ? apiKey : provider.getApiKey();
                if (!StringUtils.hasText(key)) {
                    throw new PlannerException("No API key configured for " + provider.getName()
                            + ". Add one to use " + model + ".");
                }
                return new ModelRoute(model, trimTrailingSlash(provider.getBaseUrl()),
                        provider.getCompletionsPath(), key, provider.getName());
            }
        }
        throw new PlannerException("Unknown model \"" + model + "\". Add it as a custom model with its endpoint.");
    }

    private ModelRoute customRoute(ModelEntry entry, @Nullable String apiKey) throws PlannerException {
        if (!StringUtils.hasText(entry.endpoint())) {
            throw new PlannerException("Custom model \"" + entry.id() + "\" has no endpoint.");
        }
        String key = StringUtils.hasText(entry.apiKey()) ? entry.apiKey() : apiKey;
        if (!StringUtils.hasText(key)) {
            throw new PlannerException("No API key configured for custom model \"" + entry.id() + "\".");
        }
        String baseUrl = normalizeEndpoint(entry.endpoint());
        String path = VERSION_SUFFIX.matcher(baseUrl).matches() ? CHAT_COMPLETIONS : "/v1" + CHAT_COMPLETIONS;
        return new ModelRoute(entry.id(), baseUrl, path, key, "custom");
    }

    /**
     * Strips trailing slashes and a trailing chat-completions path from a user-supplied endpoint.
     */
    static String normalizeEndpoint(String endpoint) {
        String normalized = trimTrailingSlash(endpoint.trim());
        if (normalized.endsWith(CHAT_COMPLETIONS)) {
            normalized = trimTrailingSlash(normalized.substring(0, normalized.length() - CHAT_COMPLETIONS.length()));
        }
        return normalized;
    }

    private static String trimTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

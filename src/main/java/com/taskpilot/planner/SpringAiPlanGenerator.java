package com.taskpilot.planner;

import com.taskpilot.agent.Plan;
import com.taskpilot.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Plans through a streaming chat completion. Narration is forwarded while the model writes it;
 * the plan itself is parsed only after the stream completes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiPlanGenerator implements PlanGenerator {

    private final ModelClientFactory modelClientFactory;
    private final PlannerPromptService promptService;
    private final PlanParser planParser;
    private final AgentProperties properties;

    @Override
    public Plan generate(PlanRequest request, Consumer<String> onToken) throws PlannerException {
        ChatModel chatModel = modelClientFactory.create(request.modelId(), request.customModels(), request.apiKey());
        NarrationStreamFilter filter = new NarrationStreamFilter(onToken);
        String raw = stream(chatModel, request, filter);
        filter.finish();
        Plan plan = planParser.parse(request.goal(), raw);
        if (plan.isConversational()) {
            filter.flushRemainder(plan.conversationalResponse());
        }
        log.info("Planner round {} returned {} steps{}", request.round(), plan.steps().size(),
                plan.isConversational() ? " (conversational)" : "");
        return plan;
    }

    private String stream(ChatModel chatModel, PlanRequest request, NarrationStreamFilter filter)
            throws PlannerException {
        Duration timeout = properties.getPlannerTimeout();
        try {
            List<String> chunks = ChatClient.create(chatModel).prompt()
                    .system(promptService.systemPrompt(request.allowedTools()))
                    .messages(promptService.historyMessages(request.conversation()))
                    .user(promptService.userMessage(request.goal(), request.stepHistory()))
                    .stream()
                    .content()
                    .doOnNext(filter::accept)
                    .collectList()
                    .block(timeout);
            return chunks == null ? "" : String.join("", chunks);
        } catch (RuntimeException ex) {
            throw translate(ex, timeout);
        }
    }

    static PlannerException translate(RuntimeException ex, Duration timeout) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof WebClientResponseException response) {
                return httpFailure(response.getStatusCode(), response.getMessage(), ex);
            }
            if (cause instanceof RestClientResponseException response) {
                return httpFailure(response.getStatusCode(), response.getMessage(), ex);
            }
            if (cause instanceof WebClientRequestException || cause instanceof ResourceAccessException
                    || cause instanceof ConnectException || cause instanceof UnknownHostException) {
                return new PlannerException("Could not reach the model provider: " + cause.getMessage(), ex);
            }
            cause = cause.getCause();
        }
        String message = ex.getMessage();
        if (ex instanceof IllegalStateException && message != null && message.startsWith("Timeout")) {
            return new PlannerException("The model did not respond within " + timeout.toSeconds() + " seconds.", ex);
        }
        if (message != null && (message.contains("401") || message.contains("403"))) {
            return new PlannerException("The model provider rejected the API key: " + message, ex);
        }
        return new PlannerException("Planner request failed: "
                + (StringUtils.hasText(message) ? message : ex.getClass().getSimpleName()), ex);
    }

    private static PlannerException httpFailure(HttpStatusCode status, String message, RuntimeException ex) {
        if (status.value() == 401 || status.value() == 403) {
            return new PlannerException("The model provider rejected the API key (HTTP " + status.value() + ").", ex);
        }
        return new PlannerException("The model provider returned HTTP " + status.value() + ": " + message, ex);
    }
}

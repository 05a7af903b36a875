package com.taskpilot.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.agent.Plan;
import com.taskpilot.agent.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a complete model response into a {@link Plan}.
 * <p>
 * A response without JSON is a conversational answer. A JSON object with a {@code steps}
 * array is a tool-use plan. A JSON object without steps is an answer wrapped in JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanParser {

    private static final List<String> RESPONSE_FIELDS = List.of("response", "message", "content", "text", "answer");
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Plan parse(String goal, @Nullable String raw) throws PlannerException {
        if (!StringUtils.hasText(raw)) {
            throw new PlannerException("The model returned an empty response.");
        }
        String text = raw.trim();
        JsonSlice slice = extractJsonObject(text);
        if (slice == null) {
            return Plan.conversational(goal, text);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(slice.json());
        } catch (JsonProcessingException ex) {
            if (looksLikePlan(slice.json())) {
                log.warn("Unparseable plan JSON. Snippet: {}", truncate(slice.json(), 240));
                if (!isBalanced(slice.json())) {
                    throw new PlannerException("The model response was cut off before the plan was complete.", ex);
                }
                throw new PlannerException("The model returned a plan that is not valid JSON: "
                        + ex.getOriginalMessage(), ex);
            }
            return Plan.conversational(goal, text);
        }
        if (root == null || !root.isObject()) {
            return Plan.conversational(goal, text);
        }
        JsonNode steps = root.get("steps");
        if (steps != null && steps.isArray()) {
            if (steps.isEmpty()) {
                return new Plan(goal, List.of(), conversationalText(root, slice));
            }
            String planGoal = StringUtils.hasText(textField(root, "goal")) ? textField(root, "goal") : goal;
            return new Plan(planGoal, parseSteps(steps), null);
        }
        String response = conversationalText(root, slice);
        return new Plan(goal, List.of(), response != null ? response : text);
    }

    /**
     * A step that is not an object makes the whole response unusable. A step that names no tool or
     * carries non-object parameters is kept as an invalid step so the rest of the plan still runs.
     */
    private List<Step> parseSteps(JsonNode steps) throws PlannerException {
        List<Step> parsed = new ArrayList<>();
        for (int index = 0; index < steps.size(); index++) {
            JsonNode node = steps.get(index);
            if (node == null || !node.isObject()) {
                throw new PlannerException("Plan step " + (index + 1) + " is not an object.");
            }
            String id = textField(node, "id");
            String description = textField(node, "description");
            String tool = textField(node, "tool");
            JsonNode parameters = node.get("parameters");
            if (!StringUtils.hasText(tool)) {
                log.warn("Plan step {} does not name a tool", index + 1);
                parsed.add(Step.invalid(id, description, "", "Plan step " + (index + 1) + " does not name a tool."));
            } else if (parameters != null && !parameters.isNull() && !parameters.isObject()) {
                log.warn("Plan step {} ({}) has {} parameters", index + 1, tool, parameters.getNodeType());
                parsed.add(Step.invalid(id, description, tool.trim(),
                        "Parameters of plan step " + (index + 1) + " must be an object, got: "
                                + truncate(parameters.toString(), 120)));
            } else {
                parsed.add(new Step(id, description, tool.trim(), parameters(parameters)));
            }
        }
        return parsed;
    }

    private Map<String, Object> parameters(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, PARAMETERS_TYPE);
    }

    @Nullable
    private String conversationalText(JsonNode root, JsonSlice slice) {
        for (String field : RESPONSE_FIELDS) {
            String value = textField(root, field);
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        String outside = (slice.before().trim() + "\n\n" + slice.after().trim()).trim();
        return StringUtils.hasText(outside) ? outside : null;
    }

    @Nullable
    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /**
     * Locates the JSON object in a response, looking inside a code fence first.
     * An object that never closes is returned up to the end of the text so it fails to parse.
     */
    @Nullable
    static JsonSlice extractJsonObject(String text) {
        int fenceStart = text.indexOf("```");
        if (fenceStart >= 0) {
            int bodyStart = text.indexOf('\n', fenceStart);
            int fenceEnd = bodyStart < 0 ? -1 : text.indexOf("```", bodyStart);
            if (bodyStart >= 0) {
                String body = fenceEnd < 0 ? text.substring(bodyStart + 1) : text.substring(bodyStart + 1, fenceEnd);
                int brace = body.indexOf('{');
                if (brace >= 0) {
                    String after = fenceEnd < 0 ? "" : text.substring(fenceEnd + 3);
                    return slice(body, text.substring(0, fenceStart), after);
                }
            }
        }
        if (text.indexOf('{') < 0) {
            return null;
        }
        return slice(text, "", "");
    }

    private static JsonSlice slice(String body, String prefix, String suffix) {
        int first = body.indexOf('{');
        int last = body.lastIndexOf('}');
        if (last > first) {
            return new JsonSlice(body.substring(first, last + 1),
                    prefix + body.substring(0, first), body.substring(last + 1) + suffix);
        }
        return new JsonSlice(body.substring(first), prefix + body.substring(0, first), suffix);
    }

    private static boolean looksLikePlan(String json) {
        return json.contains("\"steps\"") || json.contains("\"tool\"");
    }

    /**
     * True when every brace and bracket outside string literals is closed.
     */
    static boolean isBalanced(String json) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> depth--;
                default -> {
                }
            }
        }
        return depth == 0 && !inString;
    }

    private static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    record JsonSlice(String json, String before, String after) {
    }
}

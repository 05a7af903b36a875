package com.taskpilot.planner;

import com.taskpilot.agent.Step;
import com.taskpilot.agent.StepStatus;
import com.taskpilot.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;

import static com.taskpilot.planner.PlannerPrompts.*;

@Service
@RequiredArgsConstructor
public class PlannerPromptService {

    private final ToolRegistry toolRegistry;

    public String systemPrompt(Collection<String> allowedTools) {
        String catalogue = toolRegistry.describe(allowedTools);
        return SYSTEM_PROMPT.formatted(StringUtils.hasText(catalogue) ? "Available tools:\n\n" + catalogue : NO_TOOLS_AVAILABLE);
    }

    public List<Message> historyMessages(List<ChatTurn> conversation) {
        return ChatTurn.relevant(conversation).stream()
                .map(turn -> turn.isUser()
                        ? (Message) new UserMessage(turn.content())
                        : new AssistantMessage(turn.content()))
                .toList();
    }

    public String userMessage(String goal, List<Step> stepHistory) {
        StringBuilder message = new StringBuilder(GOAL_TEMPLATE.formatted(goal));
        if (stepHistory == null || stepHistory.isEmpty()) {
            return message.toString();
        }
        message.append("\n\n").append(HISTORY_HEADER);
        int index = 1;
        for (Step step : stepHistory) {
            message.append("\n").append(index++).append(". ")
                    .append(StringUtils.hasText(step.getTool()) ? step.getTool() : "(no tool)").append(" - ").append(step.getDescription())
                    .append(" [").append(step.getStatus().name().toLowerCase()).append("]");
            if (step.getStatus() == StepStatus.COMPLETED && StringUtils.hasText(step.getOutput())) {
                message.append("\n   Output: ").append(truncate(step.getOutput()));
            } else if (step.getStatus() == StepStatus.FAILED && StringUtils.hasText(step.getError())) {
                message.append("\n   Error: ").append(truncate(step.getError()));
            }
        }
        message.append("\n\n").append(CONTINUE_INSTRUCTION);
        return message.toString();
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_RESULT_CHARS) {
            return value;
        }
        return value.substring(0, MAX_RESULT_CHARS) + "... (truncated)";
    }
}

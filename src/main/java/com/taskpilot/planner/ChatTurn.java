package com.taskpilot.planner;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

public record ChatTurn(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatTurn user(String content) {
        return new ChatTurn(USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ASSISTANT, content);
    }

    public boolean isRelevant() {
        if (!StringUtils.hasText(role) || !StringUtils.hasText(content)) {
            return false;
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        return USER.equals(normalized) || ASSISTANT.equals(normalized);
    }

    public boolean isUser() {
        return USER.equalsIgnoreCase(role.trim());
    }

    /**
     * Drops system turns and empty messages.
     */
    public static List<ChatTurn> relevant(List<ChatTurn> turns) {
        if (turns == null) {
            return List.of();
        }
        return turns.stream().filter(turn -> turn != null && turn.isRelevant()).toList();
    }
}

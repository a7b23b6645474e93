package com.ai.codesearch.model;

/**
 * One conversation turn as forwarded to a completion model.
 */
public record ChatMessage(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String SYSTEM = "system";

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    /**
     * Maps any sender other than {@code user} or {@code system} to {@code assistant}.
     */
    public static ChatMessage of(String role, String content) {
        if (USER.equalsIgnoreCase(role)) {
            return user(content);
        }
        if (SYSTEM.equalsIgnoreCase(role)) {
            return system(content);
        }
        return assistant(content);
    }
}

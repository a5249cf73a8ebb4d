package com.voxnote.api.service.completion;

import java.util.Objects;

/**
 * One role-tagged entry of a completion request. Roles are the provider's wire values:
 * {@code system}, {@code user} or {@code assistant}.
 */
public record PromptMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public PromptMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(USER, content);
    }
}

package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Speaker of a stored chat message. Only user and assistant turns are persisted; the system
 * entry sent to the completion provider is synthesised per request and never stored.
 */
public enum ChatMessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    ChatMessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChatMessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (ChatMessageRole role : values()) {
            if (role.value.equals(normalised)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + value);
    }
}

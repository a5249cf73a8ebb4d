package com.voxnote.api.service;

import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Kinds of chat-turn failure. Callers branch on the kind, not on the exception message.
 */
public enum ChatFailure {
    /** Unknown transcription; nothing was written. */
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Malformed input; nothing was written. */
    VALIDATION(HttpStatus.BAD_REQUEST),
    /** The completion provider failed after the user turn was stored. */
    PROVIDER_FAILURE(HttpStatus.BAD_GATEWAY),
    /** The record store was unavailable. */
    STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ChatFailure(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether the caller can resend the same request without leaving duplicate rows behind. */
    public boolean retrySafe() {
        return this == NOT_FOUND || this == VALIDATION;
    }

    /** Whether a write already committed before the failure surfaced. */
    public boolean sideEffectsCommitted() {
        return this == PROVIDER_FAILURE;
    }
}

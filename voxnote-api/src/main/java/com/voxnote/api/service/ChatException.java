package com.voxnote.api.service;

public class ChatException extends RuntimeException {

    private final ChatFailure failure;
    private final boolean userTurnPersisted;

    public ChatException(ChatFailure failure, String message, Throwable cause, boolean userTurnPersisted) {
        super(message, cause);
        this.failure = failure;
        this.userTurnPersisted = userTurnPersisted;
    }

    public static ChatException notFound(long transcriptionId) {
        return new ChatException(ChatFailure.NOT_FOUND, "Transcription with ID " + transcriptionId + " not found", null, false);
    }

    public static ChatException validation(String message) {
        return new ChatException(ChatFailure.VALIDATION, message, null, false);
    }

    public static ChatException providerFailure(long transcriptionId, Throwable cause) {
        return new ChatException(ChatFailure.PROVIDER_FAILURE,
                "Failed to generate a reply for transcription " + transcriptionId, cause, true);
    }

    public static ChatException storeFailure(String message, Throwable cause, boolean userTurnPersisted) {
        return new ChatException(ChatFailure.STORE_FAILURE, message, cause, userTurnPersisted);
    }

    public ChatFailure failure() {
        return failure;
    }

    /**
     * Whether the user's message was stored before the failure. A retry after such a failure
     * stores the message a second time.
     */
    public boolean userTurnPersisted() {
        return userTurnPersisted;
    }
}

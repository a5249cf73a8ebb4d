package com.voxnote.api.service.completion;

public class CompletionProviderException extends RuntimeException {

    public CompletionProviderException(String message) {
        super(message);
    }

    public CompletionProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

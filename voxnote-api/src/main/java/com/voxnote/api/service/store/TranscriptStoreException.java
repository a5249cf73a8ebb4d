package com.voxnote.api.service.store;

public class TranscriptStoreException extends RuntimeException {

    public TranscriptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

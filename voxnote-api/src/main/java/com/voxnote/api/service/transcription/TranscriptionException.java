package com.voxnote.api.service.transcription;

import org.springframework.http.HttpStatus;

public class TranscriptionException extends RuntimeException {

    private final HttpStatus status;

    public TranscriptionException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public TranscriptionException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}

package com.voxnote.api.controller;

import com.voxnote.api.service.ChatException;
import com.voxnote.api.service.transcription.TranscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Map<String, Object>> handleChatException(ChatException exception) {
        HttpStatus status = exception.failure().status();
        if (status.is5xxServerError()) {
            log.warn("Chat turn failed ({}, user message stored: {}): {}",
                    exception.failure().code(), exception.userTurnPersisted(), exception.getMessage());
        }
        return body(status, exception.getMessage(), exception.failure().code());
    }

    @ExceptionHandler(TranscriptionException.class)
    public ResponseEntity<Map<String, Object>> handleTranscriptionException(TranscriptionException exception) {
        if (exception.status().is5xxServerError()) {
            log.warn("Transcription request failed: {}", exception.getMessage());
        }
        return body(exception.status(), exception.getMessage(), "transcription");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        String detail = exception.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Invalid request" : detail, "validation");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException exception) {
        HttpStatus status = HttpStatus.resolve(exception.getStatusCode().value());
        String reason = exception.getReason() == null ? "Request could not be processed" : exception.getReason();
        return body(status == null ? HttpStatus.BAD_REQUEST : status, reason, "request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Unhandled exception", exception);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String detail, String error) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "detail", detail,
                        "error", error
                ));
    }
}

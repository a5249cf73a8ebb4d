package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record Transcription(
        long id,
        String filename,
        String content,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
}

package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record ChatMessage(
        long id,
        @JsonProperty("transcription_id") long transcriptionId,
        ChatMessageRole role,
        String content,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
}

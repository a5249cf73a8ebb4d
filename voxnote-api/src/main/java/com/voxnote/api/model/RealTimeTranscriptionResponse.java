package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RealTimeTranscriptionResponse(
        String transcription,
        @JsonProperty("transcription_id") Long transcriptionId
) {
}

package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ChatRequest(
        @JsonProperty("transcription_id") @NotNull @Positive Long transcriptionId,
        @NotBlank String message
) {
}

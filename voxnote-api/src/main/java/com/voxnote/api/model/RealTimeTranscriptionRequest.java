package com.voxnote.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RealTimeTranscriptionRequest(
        @JsonProperty("audio_data") @NotBlank String audioData,
        @JsonProperty("file_extension") String fileExtension,
        @JsonProperty("save_to_db") Boolean saveToDb
) {

    public String fileExtensionOrDefault() {
        return fileExtension == null || fileExtension.isBlank() ? ".webm" : fileExtension.trim();
    }

    public boolean shouldSave() {
        return Boolean.TRUE.equals(saveToDb);
    }
}

package com.voxnote.api.service.transcription;

public interface SpeechToTextClient {

    /**
     * Converts the audio payload to text. The filename's extension tells the provider the format.
     *
     * @throws TranscriptionException when the provider call fails
     */
    String transcribe(String filename, byte[] audio);
}

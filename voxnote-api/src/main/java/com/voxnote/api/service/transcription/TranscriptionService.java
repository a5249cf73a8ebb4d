package com.voxnote.api.service.transcription;

import com.voxnote.api.model.RealTimeTranscriptionRequest;
import com.voxnote.api.model.RealTimeTranscriptionResponse;
import com.voxnote.api.model.Transcription;

import java.util.List;

public interface TranscriptionService {

    Transcription transcribeUpload(String filename, byte[] audio);

    RealTimeTranscriptionResponse transcribeRealTime(RealTimeTranscriptionRequest request);

    Transcription get(long transcriptionId);

    List<Transcription> list();
}

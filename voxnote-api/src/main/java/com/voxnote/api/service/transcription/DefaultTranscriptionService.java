package com.voxnote.api.service.transcription;

import com.voxnote.api.model.RealTimeTranscriptionRequest;
import com.voxnote.api.model.RealTimeTranscriptionResponse;
import com.voxnote.api.model.Transcription;
import com.voxnote.api.service.store.TranscriptStore;
import com.voxnote.api.service.store.TranscriptStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

@Service
public class DefaultTranscriptionService implements TranscriptionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultTranscriptionService.class);

    static final List<String> ALLOWED_EXTENSIONS = List.of(".mp3", ".wav", ".m4a", ".mp4", ".mpeg", ".mpga", ".webm");
    private static final String REAL_TIME_FILENAME = "real-time-recording";
    private static final int MAX_FILENAME_LENGTH = 255;

    private final SpeechToTextClient speechToTextClient;
    private final TranscriptStore store;
    private final MeterRegistry meterRegistry;

    public DefaultTranscriptionService(SpeechToTextClient speechToTextClient,
                                       TranscriptStore store,
                                       MeterRegistry meterRegistry) {
        this.speechToTextClient = speechToTextClient;
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Transcription transcribeUpload(String filename, byte[] audio) {
        if (filename == null || filename.isBlank()) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST, "No file provided");
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST, "Filename must be at most " + MAX_FILENAME_LENGTH + " characters");
        }
        String extension = extensionOf(filename);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST,
                    "Invalid file type. Allowed types: " + String.join(", ", ALLOWED_EXTENSIONS));
        }
        if (audio == null || audio.length == 0) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }

        String text = speechToTextClient.transcribe(filename, audio);
        Transcription saved = fromStore("save transcription", () -> store.saveTranscription(filename, text));
        meterRegistry.counter("voxnote.transcriptions", "source", "upload").increment();
        log.info("Stored transcription {} for {} ({} bytes of audio)", saved.id(), filename, audio.length);
        return saved;
    }

    @Override
    public RealTimeTranscriptionResponse transcribeRealTime(RealTimeTranscriptionRequest request) {
        byte[] audio;
        try {
            audio = Base64.getDecoder().decode(request.audioData().trim());
        } catch (IllegalArgumentException ex) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST, "audio_data must be base64 encoded", ex);
        }
        if (audio.length == 0) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST, "audio_data must not be empty");
        }
        String extension = request.fileExtensionOrDefault();
        if (!extension.startsWith(".")) {
            extension = "." + extension;
        }
        if (!ALLOWED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            throw new TranscriptionException(HttpStatus.BAD_REQUEST,
                    "Invalid file_extension. Allowed types: " + String.join(", ", ALLOWED_EXTENSIONS));
        }
        String filename = REAL_TIME_FILENAME + extension;

        String text = speechToTextClient.transcribe(filename, audio);
        meterRegistry.counter("voxnote.transcriptions", "source", "real_time").increment();
        if (!request.shouldSave()) {
            return new RealTimeTranscriptionResponse(text, null);
        }
        Transcription saved = fromStore("save transcription", () -> store.saveTranscription(filename, text));
        log.info("Stored real-time transcription {} ({} bytes of audio)", saved.id(), audio.length);
        return new RealTimeTranscriptionResponse(text, saved.id());
    }

    @Override
    public Transcription get(long transcriptionId) {
        return fromStore("load transcription", () -> store.findTranscription(transcriptionId))
                .orElseThrow(() -> new TranscriptionException(HttpStatus.NOT_FOUND, "Transcription not found"));
    }

    @Override
    public List<Transcription> list() {
        return fromStore("list transcriptions", store::listTranscriptions);
    }

    private String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private <T> T fromStore(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TranscriptStoreException ex) {
            throw new TranscriptionException(HttpStatus.SERVICE_UNAVAILABLE, "Failed to " + action, ex);
        }
    }
}

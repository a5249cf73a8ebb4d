package com.voxnote.api.controller;

import com.voxnote.api.model.RealTimeTranscriptionRequest;
import com.voxnote.api.model.RealTimeTranscriptionResponse;
import com.voxnote.api.model.Transcription;
import com.voxnote.api.service.transcription.TranscriptionService;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/transcriptions")
public class TranscriptionController {

    private final TranscriptionService transcriptionService;

    public TranscriptionController(TranscriptionService transcriptionService) {
        this.transcriptionService = transcriptionService;
    }

    @PostMapping(path = {"", "/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Transcription> upload(@RequestPart("file") FilePart file) {
        return DataBufferUtils.join(file.content())
                .map(this::drain)
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> transcriptionService.transcribeUpload(file.filename(), bytes));
    }

    @PostMapping(path = "/real-time", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RealTimeTranscriptionResponse> realTime(@Valid @RequestBody RealTimeTranscriptionRequest request) {
        return Mono.fromCallable(() -> transcriptionService.transcribeRealTime(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/{transcriptionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Transcription> get(@PathVariable long transcriptionId) {
        return Mono.fromCallable(() -> transcriptionService.get(transcriptionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = {"", "/"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<Transcription>> list() {
        return Mono.fromCallable(transcriptionService::list)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}

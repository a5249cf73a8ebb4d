package com.voxnote.api.service.transcription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the OpenAI-compatible {@code /v1/audio/transcriptions} endpoint.
 */
@Component
public class OpenAiSpeechToTextClient implements SpeechToTextClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSpeechToTextClient.class);

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;

    public OpenAiSpeechToTextClient(@Qualifier("speechWebClient") WebClient webClient,
                                    @Value("${voxnote.speech.model:gpt-4o-transcribe}") String model,
                                    @Value("${voxnote.speech.timeout-seconds:120}") long timeoutSeconds) {
        this.webClient = webClient;
        this.model = model;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public String transcribe(String filename, byte[] audio) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return filename;
            }
        }).contentType(MediaType.APPLICATION_OCTET_STREAM);
        body.part("model", model);

        TranscriptionPayload payload;
        try {
            payload = webClient.post()
                    .uri("/v1/audio/transcriptions")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .bodyToMono(TranscriptionPayload.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.class, this::logAndWrap)
                    .block(timeout.plusSeconds(1));
        } catch (TranscriptionException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Speech-to-text request for {} failed: {}", filename, ex.getMessage(), ex);
            throw new TranscriptionException(HttpStatus.BAD_GATEWAY, "Error transcribing audio: " + ex.getMessage(), ex);
        }
        if (payload == null || payload.text() == null) {
            throw new TranscriptionException(HttpStatus.BAD_GATEWAY, "Speech-to-text provider returned no text");
        }
        return payload.text();
    }

    private Mono<TranscriptionPayload> logAndWrap(WebClientResponseException exception) {
        int status = exception.getStatusCode().value();
        log.warn("Speech-to-text provider returned {}: {}", status, exception.getResponseBodyAsString());
        return Mono.error(new TranscriptionException(HttpStatus.BAD_GATEWAY,
                "Error transcribing audio: provider returned " + status, exception));
    }

    record TranscriptionPayload(String text) {
    }
}

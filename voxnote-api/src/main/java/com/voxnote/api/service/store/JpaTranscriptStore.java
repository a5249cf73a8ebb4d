package com.voxnote.api.service.store;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import com.voxnote.api.model.Transcription;
import com.voxnote.api.persistence.entity.ChatMessageEntity;
import com.voxnote.api.persistence.entity.TranscriptionEntity;
import com.voxnote.api.persistence.repository.ChatMessageRepository;
import com.voxnote.api.persistence.repository.TranscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational store backed by Spring Data JPA. Each repository call commits on its own, so a
 * saved row is durable as soon as the method returns. Replaced by {@link InMemoryTranscriptStore}
 * under the {@code inmemory} profile.
 */
@Service
@Profile("!inmemory")
public class JpaTranscriptStore implements TranscriptStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTranscriptStore.class);

    private final TranscriptionRepository transcriptionRepository;
    private final ChatMessageRepository chatMessageRepository;
    private final Clock clock;

    public JpaTranscriptStore(TranscriptionRepository transcriptionRepository,
                              ChatMessageRepository chatMessageRepository,
                              Clock clock) {
        this.transcriptionRepository = transcriptionRepository;
        this.chatMessageRepository = chatMessageRepository;
        this.clock = clock;
    }

    @Override
    public Transcription saveTranscription(String filename, String content) {
        return guarded("save transcription", () -> {
            TranscriptionEntity entity = new TranscriptionEntity(filename, content == null ? "" : content, now());
            return transcriptionRepository.save(entity).toModel();
        });
    }

    @Override
    public Optional<Transcription> findTranscription(long transcriptionId) {
        return guarded("load transcription " + transcriptionId,
                () -> transcriptionRepository.findById(transcriptionId).map(TranscriptionEntity::toModel));
    }

    @Override
    public List<Transcription> listTranscriptions() {
        return guarded("list transcriptions", () -> transcriptionRepository.findAllByOrderByIdAsc().stream()
                .map(TranscriptionEntity::toModel)
                .toList());
    }

    @Override
    public ChatMessage appendMessage(long transcriptionId, ChatMessageRole role, String content) {
        return guarded("append message to transcription " + transcriptionId, () -> {
            OffsetDateTime createdAt = now();
            OffsetDateTime newest = chatMessageRepository.findFirstByTranscriptionIdOrderByCreatedAtDescIdDesc(transcriptionId)
                    .map(ChatMessageEntity::getCreatedAt)
                    .orElse(null);
            if (newest != null && newest.isAfter(createdAt)) {
                createdAt = newest;
            }
            ChatMessageEntity saved = chatMessageRepository.save(new ChatMessageEntity(transcriptionId, role, content, createdAt));
            log.debug("Stored {} message {} for transcription {}", role.value(), saved.getId(), transcriptionId);
            return saved.toModel();
        });
    }

    @Override
    public List<ChatMessage> recentMessages(long transcriptionId, int limit) {
        return guarded("load recent messages for transcription " + transcriptionId, () -> chatMessageRepository
                .findByTranscriptionIdOrderByCreatedAtDescIdDesc(transcriptionId, PageRequest.of(0, limit))
                .stream()
                .map(ChatMessageEntity::toModel)
                .toList());
    }

    @Override
    public List<ChatMessage> messages(long transcriptionId) {
        return guarded("load messages for transcription " + transcriptionId, () -> chatMessageRepository
                .findByTranscriptionIdOrderByCreatedAtAscIdAsc(transcriptionId)
                .stream()
                .map(ChatMessageEntity::toModel)
                .toList());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private <T> T guarded(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException ex) {
            log.error("Record store failed to {}", action, ex);
            throw new TranscriptStoreException("Failed to " + action, ex);
        }
    }
}

package com.voxnote.api.service.store;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import com.voxnote.api.model.Transcription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Profile("inmemory")
public class InMemoryTranscriptStore implements TranscriptStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTranscriptStore.class);

    private static final Comparator<ChatMessage> CHRONOLOGICAL = Comparator
            .comparing(ChatMessage::createdAt)
            .thenComparingLong(ChatMessage::id);

    private final Map<Long, Transcription> transcriptions = new ConcurrentHashMap<>();
    private final Map<Long, List<ChatMessage>> messages = new ConcurrentHashMap<>();
    private final AtomicLong transcriptionIds = new AtomicLong();
    private final AtomicLong messageIds = new AtomicLong();
    private final Clock clock;

    public InMemoryTranscriptStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Transcription saveTranscription(String filename, String content) {
        long id = transcriptionIds.incrementAndGet();
        Transcription transcription = new Transcription(id, filename, content == null ? "" : content, OffsetDateTime.now(clock));
        transcriptions.put(id, transcription);
        return transcription;
    }

    @Override
    public Optional<Transcription> findTranscription(long transcriptionId) {
        return Optional.ofNullable(transcriptions.get(transcriptionId));
    }

    @Override
    public List<Transcription> listTranscriptions() {
        return transcriptions.values().stream()
                .sorted(Comparator.comparingLong(Transcription::id))
                .toList();
    }

    @Override
    public ChatMessage appendMessage(long transcriptionId, ChatMessageRole role, String content) {
        ChatMessage[] stored = new ChatMessage[1];
        messages.compute(transcriptionId, (key, existing) -> {
            List<ChatMessage> thread = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            OffsetDateTime createdAt = OffsetDateTime.now(clock);
            if (!thread.isEmpty()) {
                OffsetDateTime newest = thread.get(thread.size() - 1).createdAt();
                if (newest.isAfter(createdAt)) {
                    createdAt = newest;
                }
            }
            stored[0] = new ChatMessage(messageIds.incrementAndGet(), transcriptionId, role, content, createdAt);
            thread.add(stored[0]);
            return thread;
        });
        log.debug("Stored {} message {} for transcription {}", role.value(), stored[0].id(), transcriptionId);
        return stored[0];
    }

    @Override
    public List<ChatMessage> recentMessages(long transcriptionId, int limit) {
        List<ChatMessage> newestFirst = new ArrayList<>(messages(transcriptionId));
        Collections.reverse(newestFirst);
        return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
    }

    @Override
    public List<ChatMessage> messages(long transcriptionId) {
        List<ChatMessage> thread = messages.getOrDefault(transcriptionId, List.of());
        return thread.stream().sorted(CHRONOLOGICAL).toList();
    }
}

package com.voxnote.api.service.history;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.service.store.TranscriptStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view over the chat thread of a transcription.
 */
@Component
public class ChatHistoryReader {

    private final TranscriptStore store;

    public ChatHistoryReader(TranscriptStore store) {
        this.store = store;
    }

    /**
     * The {@code limit} most recent messages of the transcription, oldest first.
     */
    public List<ChatMessage> recentWindow(long transcriptionId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History window must be positive but was " + limit);
        }
        List<ChatMessage> chronological = new ArrayList<>(store.recentMessages(transcriptionId, limit));
        Collections.reverse(chronological);
        return List.copyOf(chronological);
    }

    public List<ChatMessage> fullHistory(long transcriptionId) {
        return store.messages(transcriptionId);
    }
}

package com.voxnote.api.service.store;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import com.voxnote.api.model.Transcription;

import java.util.List;
import java.util.Optional;

/**
 * Durable record store for transcriptions and the chat messages anchored to them.
 * <p>
 * Every write is atomic on its own; callers sequence multiple writes themselves. Implementations
 * assign ids and creation timestamps, and never hand out a message timestamp earlier than the
 * newest message already stored for the same transcription.
 */
public interface TranscriptStore {

    Transcription saveTranscription(String filename, String content);

    Optional<Transcription> findTranscription(long transcriptionId);

    List<Transcription> listTranscriptions();

    ChatMessage appendMessage(long transcriptionId, ChatMessageRole role, String content);

    /**
     * Returns at most {@code limit} of the newest messages for the transcription, newest first,
     * ties on the timestamp broken by descending id.
     */
    List<ChatMessage> recentMessages(long transcriptionId, int limit);

    /**
     * Returns every message for the transcription, oldest first.
     */
    List<ChatMessage> messages(long transcriptionId);
}

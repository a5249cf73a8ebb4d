package com.voxnote.api.service;

import com.voxnote.api.model.ChatMessage;

import java.util.List;

public interface ChatService {

    /**
     * Runs one chat turn against a transcription and returns the assistant's reply.
     *
     * @throws ChatException tagged with the {@link ChatFailure} that stopped the turn
     */
    String handle(long transcriptionId, String userMessage);

    List<ChatMessage> history(long transcriptionId);
}

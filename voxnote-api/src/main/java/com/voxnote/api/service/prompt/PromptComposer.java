package com.voxnote.api.service.prompt;

import com.voxnote.api.config.ConversationProperties;
import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.service.completion.PromptMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ordered message list sent to the completion provider for one chat turn.
 * <p>
 * The result always has {@code history.size() + 2} entries: a system entry grounding the model
 * in the full transcription text, the supplied history in the given order, and the current user
 * message last. The transcription is never truncated. Inputs are not modified.
 */
@Component
public class PromptComposer {

    private final String systemPrompt;

    public PromptComposer(ConversationProperties properties) {
        this.systemPrompt = properties.getSystemPrompt();
    }

    public List<PromptMessage> compose(String transcriptionContent, List<ChatMessage> history, String currentMessage) {
        List<ChatMessage> turns = history == null ? List.of() : history;
        List<PromptMessage> messages = new ArrayList<>(turns.size() + 2);
        messages.add(PromptMessage.system(systemPrompt + (transcriptionContent == null ? "" : transcriptionContent)));
        for (ChatMessage turn : turns) {
            messages.add(new PromptMessage(turn.role().value(), turn.content()));
        }
        messages.add(PromptMessage.user(currentMessage));
        return List.copyOf(messages);
    }
}

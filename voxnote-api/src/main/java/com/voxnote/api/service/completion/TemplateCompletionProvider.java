package com.voxnote.api.service.completion;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Offline stand-in that answers without calling a model. Handy for local UI work.
 */
@Component
@Profile("template")
public class TemplateCompletionProvider implements CompletionProvider {

    @Override
    public String complete(List<PromptMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new CompletionProviderException("No messages to answer");
        }
        PromptMessage last = messages.get(messages.size() - 1);
        long priorTurns = messages.stream()
                .filter(message -> !PromptMessage.SYSTEM.equals(message.role()))
                .count() - 1;
        return "You asked: \"" + normalise(last.content()) + "\". "
                + "This is a template reply with " + priorTurns + " earlier turn(s) in context.";
    }

    private String normalise(String text) {
        String trimmed = text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= 240) {
            return trimmed;
        }
        return trimmed.substring(0, 237) + "...";
    }
}

package com.voxnote.api.service.prompt;

import com.voxnote.api.config.ConversationProperties;
import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import com.voxnote.api.service.completion.PromptMessage;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

class PromptComposerTest {

    private final PromptComposer composer = new PromptComposer(new ConversationProperties());

    @Test
    void composesSystemThenHistoryThenCurrentMessage() {
        List<ChatMessage> history = List.of(
                message(1, ChatMessageRole.USER, "Who is speaking?"),
                message(2, ChatMessageRole.ASSISTANT, "A single narrator.")
        );

        List<PromptMessage> prompt = composer.compose("Hello world", history, "What does it say?");

        assertThat(prompt).hasSize(history.size() + 2);
        assertThat(prompt.get(0).role()).isEqualTo("system");
        assertThat(prompt.get(0).content())
                .isEqualTo(ConversationProperties.DEFAULT_SYSTEM_PROMPT + "Hello world");
        assertThat(prompt.subList(1, 3))
                .extracting(PromptMessage::role, PromptMessage::content)
                .containsExactly(
                        tuple("user", "Who is speaking?"),
                        tuple("assistant", "A single narrator."));
        assertThat(prompt.get(prompt.size() - 1)).isEqualTo(PromptMessage.user("What does it say?"));
    }

    @Test
    void emptyHistoryYieldsSystemAndUserOnly() {
        List<PromptMessage> prompt = composer.compose("", List.of(), "hi");

        assertThat(prompt).extracting(PromptMessage::role).containsExactly("system", "user");
        assertThat(prompt.get(0).content()).isEqualTo(ConversationProperties.DEFAULT_SYSTEM_PROMPT);
    }

    @Test
    void keepsLongTranscriptionVerbatim() {
        String transcript = "word ".repeat(50_000);

        List<PromptMessage> prompt = composer.compose(transcript, List.of(), "Summarise");

        assertThat(prompt.get(0).content()).endsWith(transcript);
    }

    @Test
    void doesNotDeduplicateRepeatedTurns() {
        List<ChatMessage> history = List.of(
                message(1, ChatMessageRole.USER, "hi"),
                message(2, ChatMessageRole.USER, "hi")
        );

        List<PromptMessage> prompt = composer.compose("text", history, "hi");

        assertThat(prompt).hasSize(4);
        assertThat(prompt.subList(1, 4)).extracting(PromptMessage::content).containsOnly("hi");
    }

    @Test
    void leavesInputsUntouchedAndReturnsImmutableList() {
        List<ChatMessage> history = new ArrayList<>(List.of(message(1, ChatMessageRole.USER, "first")));
        List<ChatMessage> snapshot = List.copyOf(history);

        List<PromptMessage> prompt = composer.compose("text", history, "second");

        assertThat(history).isEqualTo(snapshot);
        assertThatThrownBy(() -> prompt.add(PromptMessage.user("extra")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void usesConfiguredSystemPrompt() {
        ConversationProperties properties = new ConversationProperties();
        properties.setSystemPrompt("Transcript:\n");

        List<PromptMessage> prompt = new PromptComposer(properties).compose("abc", List.of(), "q");

        assertThat(prompt.get(0).content()).isEqualTo("Transcript:\nabc");
    }

    private ChatMessage message(long id, ChatMessageRole role, String content) {
        return new ChatMessage(id, 1L, role, content, OffsetDateTime.parse("2024-05-01T10:00:00Z").plusSeconds(id));
    }
}

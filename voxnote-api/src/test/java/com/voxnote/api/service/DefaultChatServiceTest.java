package com.voxnote.api.service;

import com.voxnote.api.config.ConversationProperties;
import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import com.voxnote.api.model.Transcription;
import com.voxnote.api.service.completion.CompletionProvider;
import com.voxnote.api.service.completion.CompletionProviderException;
import com.voxnote.api.service.completion.PromptMessage;
import com.voxnote.api.service.history.ChatHistoryReader;
import com.voxnote.api.service.prompt.PromptComposer;
import com.voxnote.api.service.store.InMemoryTranscriptStore;
import com.voxnote.api.service.store.TranscriptStore;
import com.voxnote.api.service.store.TranscriptStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DefaultChatServiceTest {

    private final CompletionProvider completionProvider = mock(CompletionProvider.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ConversationProperties properties = new ConversationProperties();

    private InMemoryTranscriptStore store;
    private DefaultChatService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTranscriptStore(Clock.systemUTC());
        service = serviceOver(store);
    }

    @Test
    void answersAndStoresBothTurns() {
        Transcription transcription = store.saveTranscription("hello.mp3", "Hello world");
        when(completionProvider.complete(any())).thenReturn("It says hello world.");

        String answer = service.handle(transcription.id(), "What does it say?");

        assertThat(answer).isEqualTo("It says hello world.");
        List<ChatMessage> stored = store.messages(transcription.id());
        assertThat(stored)
                .extracting(ChatMessage::role, ChatMessage::content)
                .containsExactly(
                        tuple(ChatMessageRole.USER, "What does it say?"),
                        tuple(ChatMessageRole.ASSISTANT, "It says hello world."));
        assertThat(stored.get(0).createdAt()).isBeforeOrEqualTo(stored.get(1).createdAt());
        assertThat(meterRegistry.counter("voxnote.chat.turns", "outcome", "answered").count()).isEqualTo(1.0);
    }

    @Test
    void sendsTranscriptionHistoryAndCurrentMessageToProvider() {
        Transcription transcription = store.saveTranscription("hello.mp3", "Hello world");
        store.appendMessage(transcription.id(), ChatMessageRole.USER, "Earlier question");
        store.appendMessage(transcription.id(), ChatMessageRole.ASSISTANT, "Earlier answer");
        when(completionProvider.complete(any())).thenReturn("reply");

        service.handle(transcription.id(), "Next question");

        List<PromptMessage> prompt = capturedPrompt();
        assertThat(prompt).extracting(PromptMessage::role)
                .containsExactly("system", "user", "assistant", "user");
        assertThat(prompt.get(0).content()).contains("Hello world");
        assertThat(prompt.get(3).content()).isEqualTo("Next question");
    }

    @Test
    void replaysOnlyTheConfiguredHistoryWindow() {
        Transcription transcription = store.saveTranscription("long.mp3", "content");
        for (int i = 1; i <= 14; i++) {
            store.appendMessage(transcription.id(), i % 2 == 1 ? ChatMessageRole.USER : ChatMessageRole.ASSISTANT, "turn " + i);
        }
        when(completionProvider.complete(any())).thenReturn("reply");

        service.handle(transcription.id(), "latest");

        List<PromptMessage> prompt = capturedPrompt();
        assertThat(prompt).hasSize(1 + ConversationProperties.DEFAULT_HISTORY_WINDOW + 1);
        assertThat(prompt.get(1).content()).isEqualTo("turn 5");
        assertThat(prompt.get(10).content()).isEqualTo("turn 14");
        assertThat(prompt.get(11).content()).isEqualTo("latest");
    }

    @Test
    void unknownTranscriptionFailsWithoutSideEffects() {
        ChatException failure = catchThrowableOfType(() -> service.handle(999L, "hi"), ChatException.class);

        assertThat(failure.failure()).isEqualTo(ChatFailure.NOT_FOUND);
        assertThat(failure.failure().retrySafe()).isTrue();
        assertThat(failure.userTurnPersisted()).isFalse();
        assertThat(store.messages(999L)).isEmpty();
        verifyNoInteractions(completionProvider);
    }

    @Test
    void providerFailureKeepsUserTurnOnly() {
        Transcription transcription = store.saveTranscription("two.mp3", "Second recording");
        when(completionProvider.complete(any()))
                .thenThrow(new CompletionProviderException("timed out", new TimeoutException()));

        ChatException failure = catchThrowableOfType(() -> service.handle(transcription.id(), "hi"), ChatException.class);

        assertThat(failure.failure()).isEqualTo(ChatFailure.PROVIDER_FAILURE);
        assertThat(failure.failure().sideEffectsCommitted()).isTrue();
        assertThat(failure.failure().retrySafe()).isFalse();
        assertThat(failure.userTurnPersisted()).isTrue();
        assertThat(failure).hasCauseInstanceOf(CompletionProviderException.class);
        assertThat(store.messages(transcription.id()))
                .singleElement()
                .satisfies(message -> {
                    assertThat(message.role()).isEqualTo(ChatMessageRole.USER);
                    assertThat(message.content()).isEqualTo("hi");
                });
        assertThat(meterRegistry.counter("voxnote.chat.turns", "outcome", "provider_failure").count()).isEqualTo(1.0);
    }

    @Test
    void retryAfterProviderFailureStoresSecondUserTurn() {
        Transcription transcription = store.saveTranscription("retry.mp3", "text");
        when(completionProvider.complete(any()))
                .thenThrow(new CompletionProviderException("down"))
                .thenReturn("back up");

        catchThrowableOfType(() -> service.handle(transcription.id(), "hello?"), ChatException.class);
        String answer = service.handle(transcription.id(), "hello?");

        assertThat(answer).isEqualTo("back up");
        assertThat(store.messages(transcription.id()))
                .extracting(ChatMessage::role)
                .containsExactly(ChatMessageRole.USER, ChatMessageRole.USER, ChatMessageRole.ASSISTANT);
    }

    @Test
    void blankMessageIsRejectedBeforeAnyLookup() {
        TranscriptStore strictStore = mock(TranscriptStore.class);
        DefaultChatService strictService = serviceOver(strictStore);

        ChatException failure = catchThrowableOfType(() -> strictService.handle(1L, "   "), ChatException.class);

        assertThat(failure.failure()).isEqualTo(ChatFailure.VALIDATION);
        verifyNoInteractions(strictStore, completionProvider);
    }

    @Test
    void storeFailureWhileSavingAssistantTurnIsReportedWithUserTurnPersisted() {
        TranscriptStore failingStore = mock(TranscriptStore.class);
        Transcription transcription = new Transcription(5L, "x.mp3", "text", null);
        ChatMessage userTurn = new ChatMessage(1L, 5L, ChatMessageRole.USER, "hi", null);
        when(failingStore.findTranscription(5L)).thenReturn(Optional.of(transcription));
        when(failingStore.recentMessages(anyLong(), anyInt())).thenReturn(List.of());
        when(failingStore.appendMessage(eq(5L), eq(ChatMessageRole.USER), anyString())).thenReturn(userTurn);
        when(failingStore.appendMessage(eq(5L), eq(ChatMessageRole.ASSISTANT), anyString()))
                .thenThrow(new TranscriptStoreException("database down", new RuntimeException()));
        when(completionProvider.complete(any())).thenReturn("reply");

        ChatException failure = catchThrowableOfType(() -> serviceOver(failingStore).handle(5L, "hi"), ChatException.class);

        assertThat(failure.failure()).isEqualTo(ChatFailure.STORE_FAILURE);
        assertThat(failure.userTurnPersisted()).isTrue();
    }

    @Test
    void storeFailureBeforeAnyWriteIsNotPersisted() {
        TranscriptStore failingStore = mock(TranscriptStore.class);
        when(failingStore.findTranscription(7L))
                .thenThrow(new TranscriptStoreException("database down", new RuntimeException()));

        ChatException failure = catchThrowableOfType(() -> serviceOver(failingStore).handle(7L, "hi"), ChatException.class);

        assertThat(failure.failure()).isEqualTo(ChatFailure.STORE_FAILURE);
        assertThat(failure.userTurnPersisted()).isFalse();
        verifyNoInteractions(completionProvider);
    }

    @Test
    void historyListsAllMessagesOldestFirst() {
        Transcription transcription = store.saveTranscription("h.mp3", "text");
        store.appendMessage(transcription.id(), ChatMessageRole.USER, "q");
        store.appendMessage(transcription.id(), ChatMessageRole.ASSISTANT, "a");

        assertThat(service.history(transcription.id()))
                .extracting(ChatMessage::content)
                .containsExactly("q", "a");
        assertThat(service.history(12345L)).isEmpty();
    }

    @SuppressWarnings("unchecked")
    private List<PromptMessage> capturedPrompt() {
        ArgumentCaptor<List<PromptMessage>> captor = ArgumentCaptor.forClass((Class) List.class);
        verify(completionProvider).complete(captor.capture());
        return captor.getValue();
    }

    private DefaultChatService serviceOver(TranscriptStore transcriptStore) {
        return new DefaultChatService(
                transcriptStore,
                new ChatHistoryReader(transcriptStore),
                new PromptComposer(properties),
                completionProvider,
                meterRegistry,
                properties
        );
    }
}

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
import com.voxnote.api.service.store.TranscriptStore;
import com.voxnote.api.service.store.TranscriptStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Chat turn sequencing. Each step's write is durable before the next step starts, and the
 * sequence as a whole is not transactional: a provider failure leaves the user turn stored
 * without an assistant reply.
 */
@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String TURN_METRIC = "voxnote.chat.turns";
    private static final String COMPLETION_METRIC = "voxnote.chat.completion";

    private final TranscriptStore store;
    private final ChatHistoryReader historyReader;
    private final PromptComposer promptComposer;
    private final CompletionProvider completionProvider;
    private final MeterRegistry meterRegistry;
    private final int historyWindow;

    public DefaultChatService(TranscriptStore store,
                              ChatHistoryReader historyReader,
                              PromptComposer promptComposer,
                              CompletionProvider completionProvider,
                              MeterRegistry meterRegistry,
                              ConversationProperties properties) {
        this.store = store;
        this.historyReader = historyReader;
        this.promptComposer = promptComposer;
        this.completionProvider = completionProvider;
        this.meterRegistry = meterRegistry;
        this.historyWindow = properties.getHistoryWindow();
    }

    @Override
    public String handle(long transcriptionId, String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            countTurn(ChatFailure.VALIDATION.code());
            throw ChatException.validation("Message must not be empty");
        }

        Transcription transcription = fromStore("load transcription " + transcriptionId, false,
                () -> store.findTranscription(transcriptionId))
                .orElseThrow(() -> {
                    countTurn(ChatFailure.NOT_FOUND.code());
                    return ChatException.notFound(transcriptionId);
                });

        List<ChatMessage> history = fromStore("load history for transcription " + transcriptionId, false,
                () -> historyReader.recentWindow(transcriptionId, historyWindow));
        log.debug("Loaded {} prior message(s) for transcription {}", history.size(), transcriptionId);

        ChatMessage userTurn = fromStore("store user message for transcription " + transcriptionId, false,
                () -> store.appendMessage(transcriptionId, ChatMessageRole.USER, userMessage));

        List<PromptMessage> prompt = promptComposer.compose(transcription.content(), history, userTurn.content());

        String answer;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            answer = completionProvider.complete(prompt);
        } catch (CompletionProviderException ex) {
            countTurn(ChatFailure.PROVIDER_FAILURE.code());
            log.warn("Completion failed for transcription {} after storing user message {}: {}",
                    transcriptionId, userTurn.id(), ex.getMessage());
            throw ChatException.providerFailure(transcriptionId, ex);
        } finally {
            sample.stop(meterRegistry.timer(COMPLETION_METRIC));
        }

        ChatMessage assistantTurn = fromStore("store assistant message for transcription " + transcriptionId, true,
                () -> store.appendMessage(transcriptionId, ChatMessageRole.ASSISTANT, answer));

        countTurn("answered");
        log.info("Answered chat turn for transcription {} (user message {}, assistant message {})",
                transcriptionId, userTurn.id(), assistantTurn.id());
        return answer;
    }

    @Override
    public List<ChatMessage> history(long transcriptionId) {
        return fromStore("load history for transcription " + transcriptionId, false,
                () -> historyReader.fullHistory(transcriptionId));
    }

    private <T> T fromStore(String action, boolean userTurnPersisted, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TranscriptStoreException ex) {
            countTurn(ChatFailure.STORE_FAILURE.code());
            throw ChatException.storeFailure("Failed to " + action, ex, userTurnPersisted);
        }
    }

    private void countTurn(String outcome) {
        meterRegistry.counter(TURN_METRIC, "outcome", outcome).increment();
    }
}

package com.voxnote.api.service.completion;

import com.voxnote.api.service.completion.openai.OpenAiChatClient;
import com.voxnote.api.service.completion.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Component
@Profile("!template")
public class OpenAiCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionProvider.class);

    private final OpenAiChatClient chatClient;
    private final String model;
    private final Double temperature;
    private final Integer maxOutputTokens;

    public OpenAiCompletionProvider(OpenAiChatClient chatClient,
                                    @Value("${voxnote.llm.model:gpt-4o}") String model,
                                    @Value("${voxnote.llm.temperature:#{null}}") Double temperature,
                                    @Value("${voxnote.llm.max-output-tokens:#{null}}") Integer maxOutputTokens) {
        this.chatClient = chatClient;
        this.model = Objects.requireNonNullElse(model, "gpt-4o");
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    public String complete(List<PromptMessage> messages) {
        List<OpenAiChatClient.Message> payload = messages.stream()
                .map(message -> new OpenAiChatClient.Message(message.role(), message.content()))
                .toList();
        OpenAiChatClient.ChatCompletionResponse response;
        try {
            response = chatClient.complete(new OpenAiChatClient.Request(model, payload, temperature, maxOutputTokens));
        } catch (OpenAiChatException ex) {
            throw new CompletionProviderException("Completion provider call failed: " + ex.getMessage(), ex);
        }
        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            log.warn("Completion response from model {} carried no content", model);
            throw new CompletionProviderException("Completion provider returned an empty reply");
        }
        if (response.usage() != null) {
            log.debug("Completion used {} tokens ({} prompt, {} completion)",
                    response.usage().totalTokens(), response.usage().promptTokens(), response.usage().completionTokens());
        }
        return choice.message().content();
    }
}

package com.voxnote.api.service.completion;

import java.util.List;

public interface CompletionProvider {

    /**
     * Returns the provider's reply to the ordered conversation.
     *
     * @throws CompletionProviderException when the call fails, times out or yields no text
     */
    String complete(List<PromptMessage> messages);
}

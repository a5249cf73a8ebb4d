package com.voxnote.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "voxnote.chat")
public class ConversationProperties {

    public static final int DEFAULT_HISTORY_WINDOW = 10;
    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are an assistant helping with questions about a transcribed audio. Here is the transcription: ";

    /**
     * Number of most recent chat messages replayed to the model on each turn.
     */
    private int historyWindow = DEFAULT_HISTORY_WINDOW;

    /**
     * Instruction prefix of the system entry; the transcription text is appended verbatim.
     */
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        if (historyWindow < 1) {
            throw new IllegalArgumentException("voxnote.chat.history-window must be positive");
        }
        this.historyWindow = historyWindow;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }
}

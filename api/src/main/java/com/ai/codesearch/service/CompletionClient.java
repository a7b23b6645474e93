package com.ai.codesearch.service;

import com.ai.codesearch.model.ChatMessage;
import com.ai.codesearch.model.CompletionOptions;

import java.util.List;

/**
 * Chat completion capability used by the clarification gate and answer generation.
 */
public interface CompletionClient {

    /**
     * @return the completion text, or an empty string when the model produced none
     */
    String complete(String systemPrompt, List<ChatMessage> messages, CompletionOptions options);
}

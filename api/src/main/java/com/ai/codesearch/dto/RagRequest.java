package com.ai.codesearch.dto;

import com.ai.codesearch.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request body shared by the retrieval, gate and ask endpoints. The gate only
 * reads {@code query} and {@code context}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RagRequest(
        String query,
        List<ConversationTurnDto> context,
        SearchMetadata metadata) {
    public RagRequest {
        if (context == null) {
            context = List.of();
        }
    }

    public List<ChatMessage> history() {
        return context.stream()
                .map(ConversationTurnDto::toChatMessage)
                .toList();
    }
}

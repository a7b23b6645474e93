package com.ai.codesearch.dto;

import com.ai.codesearch.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.OffsetDateTime;

/**
 * One prior turn as sent by the chat client. Accepts either {@code role/content}
 * or the client's own {@code sender/text} message shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationTurnDto(
        String id,
        String role,
        String content,
        String sender,
        String text,
        OffsetDateTime timestamp) {

    public ChatMessage toChatMessage() {
        String effectiveRole = role != null ? role : sender;
        String effectiveContent = content != null ? content : text;
        return ChatMessage.of(effectiveRole, effectiveContent != null ? effectiveContent : "");
    }
}

package com.ai.codesearch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code continue} is true only when the query can go straight to retrieval;
 * otherwise {@code message} holds the clarifying question.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateResponse(
        boolean success,
        @JsonProperty("continue") boolean proceed,
        String message,
        String error) {

    public static final String PROCEED_MESSAGE = "Query is clear, proceeding to RAG";

    public static GateResponse proceeding() {
        return new GateResponse(true, true, PROCEED_MESSAGE, null);
    }

    public static GateResponse clarify(String question) {
        return new GateResponse(true, false, question, null);
    }

    public static GateResponse failure(String error) {
        return new GateResponse(false, false, null, error);
    }
}

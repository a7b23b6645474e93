package com.ai.codesearch.model;

import java.util.List;

/**
 * Result of one user turn: either a clarifying question or a grounded answer
 * with the documents it was built from.
 */
public record AnswerResult(Kind kind, String text, List<RetrievedDocument> sources) {

    public enum Kind {
        CLARIFY,
        ANSWER
    }

    public static AnswerResult clarify(String question) {
        return new AnswerResult(Kind.CLARIFY, question, List.of());
    }

    public static AnswerResult answer(String text, List<RetrievedDocument> sources) {
        return new AnswerResult(Kind.ANSWER, text, List.copyOf(sources));
    }
}

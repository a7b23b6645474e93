package com.ai.codesearch.model;

/**
 * Outcome of the clarification gate. {@code MALFORMED} always carries the
 * generic fallback question and is treated like {@code CLARIFY}.
 */
public record GateDecision(Kind kind, String question) {

    public enum Kind {
        PROCEED,
        CLARIFY,
        MALFORMED
    }

    public static GateDecision proceed() {
        return new GateDecision(Kind.PROCEED, null);
    }

    public static GateDecision clarify(String question) {
        return new GateDecision(Kind.CLARIFY, question);
    }

    public static GateDecision malformed(String fallbackQuestion) {
        return new GateDecision(Kind.MALFORMED, fallbackQuestion);
    }

    public boolean isProceed() {
        return kind == Kind.PROCEED;
    }
}

package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.model.ChatMessage;
import com.ai.codesearch.model.CompletionOptions;
import com.ai.codesearch.model.GateDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a query is specific enough to search for, or whether the
 * user should be asked one clarifying question first.
 */
@Service
public class ClarificationGate {

    private static final Logger log = LoggerFactory.getLogger(ClarificationGate.class);

    public static final String PROCEED_SENTINEL = "ALL_GOOD";
    public static final String CLARIFY_PREFIX = "ASK:";
    public static final String FALLBACK_QUESTION = "Could you please provide more details about your question?";

    static final int GATE_MAX_TOKENS = 100;

    private final CompletionClient completionClient;
    private final CodeSearchProperties.Completion settings;
    private final int historyWindow;

    public ClarificationGate(CompletionClient completionClient, CodeSearchProperties properties) {
        this.completionClient = completionClient;
        this.settings = properties.getCompletion();
        this.historyWindow = properties.getConversation().getHistoryWindow();
    }

    public GateDecision gate(String query) {
        return gate(query, List.of());
    }

    /**
     * Single completion call, no retry. A malformed completion resolves to the
     * fallback question, never to proceed.
     *
     * @param history prior turns, oldest first; only the most recent window is sent
     */
    public GateDecision gate(String query, List<ChatMessage> history) {
        List<ChatMessage> messages = new ArrayList<>();
        if (history != null) {
            messages.addAll(history.subList(Math.max(0, history.size() - historyWindow), history.size()));
        }
        messages.add(ChatMessage.user(query));

        String completion = completionClient.complete(
                buildSystemPrompt(query),
                messages,
                new CompletionOptions(settings.getGateModel(), settings.getTemperature(), GATE_MAX_TOKENS));

        GateDecision decision = parse(completion);
        log.info("[ClarificationGate] Query '{}' -> {}", abbreviate(query), decision.kind());
        return decision;
    }

    static GateDecision parse(String completion) {
        String text = completion == null ? "" : completion.trim();
        if (text.startsWith(PROCEED_SENTINEL)) {
            return GateDecision.proceed();
        }
        if (text.startsWith(CLARIFY_PREFIX)) {
            String question = text.substring(CLARIFY_PREFIX.length()).trim();
            if (!question.isEmpty()) {
                return GateDecision.clarify(question);
            }
        }
        log.debug("[ClarificationGate] Unexpected gate response: '{}'", abbreviate(text));
        return GateDecision.malformed(FALLBACK_QUESTION);
    }

    private static String buildSystemPrompt(String query) {
        return """
                You are the gate to a RAG application answering the user query: "%s".

                The RAG's retrieval will query a database with indexed code from different packages.

                Make sure the user included enough information so the vector search will be accurate.

                - You don't always need to ask a question, if the user intent is explicit, respond with exactly "ALL_GOOD"
                - If the user message clearly mentions an intent or a technology, respond with exactly "ALL_GOOD"
                - If the user message is too cryptic or vague, respond with exactly "ASK: <one-sentence question>"

                Your response should start with either "ALL_GOOD" or "ASK:" and nothing else.
                Don't include <think> tags in your response.
                """.formatted(query);
    }

    static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}

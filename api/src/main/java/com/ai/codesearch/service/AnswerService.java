package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.model.AnswerResult;
import com.ai.codesearch.model.ChatMessage;
import com.ai.codesearch.model.CompletionOptions;
import com.ai.codesearch.model.GateDecision;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One user turn: gate, then retrieval and answer generation. Holds no state
 * between turns; the caller owns the conversation.
 */
@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    static final String NO_ANSWER = "I apologize, but I was unable to generate a response.";

    private final ClarificationGate gate;
    private final RetrievalService retrievalService;
    private final CompletionClient completionClient;
    private final CodeSearchProperties.Completion completionSettings;
    private final int historyWindow;

    public AnswerService(
            ClarificationGate gate,
            RetrievalService retrievalService,
            CompletionClient completionClient,
            CodeSearchProperties properties) {
        this.gate = gate;
        this.retrievalService = retrievalService;
        this.completionClient = completionClient;
        this.completionSettings = properties.getCompletion();
        this.historyWindow = properties.getConversation().getHistoryWindow();
    }

    public AnswerResult answer(String query, List<ChatMessage> history, MetadataFilter filter) {
        List<ChatMessage> recent = recentHistory(history);

        GateDecision decision = gate.gate(query, recent);
        if (!decision.isProceed()) {
            log.info("[AnswerService] Asking for clarification ({})", decision.kind());
            return AnswerResult.clarify(decision.question());
        }
        return generate(query, recent, filter);
    }

    /**
     * Retrieval and generation only, for callers that ran the gate themselves.
     */
    public AnswerResult answerWithoutGate(String query, List<ChatMessage> history, MetadataFilter filter) {
        return generate(query, recentHistory(history), filter);
    }

    private AnswerResult generate(String query, List<ChatMessage> recent, MetadataFilter filter) {
        RetrievalResult retrieval = retrievalService.retrieve(query, filter);

        String completion = completionClient.complete(
                buildAnswerPrompt(query, recent, retrieval.contextText()),
                List.of(),
                new CompletionOptions(completionSettings.getModel(), completionSettings.getTemperature(),
                        completionSettings.getMaxTokens()));

        String text = (completion == null || completion.isBlank()) ? NO_ANSWER : completion;
        log.info("[AnswerService] Answer generated from {} documents", retrieval.documents().size());
        return AnswerResult.answer(text, retrieval.documents());
    }

    /**
     * Most recent turns, oldest first.
     */
    List<ChatMessage> recentHistory(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, history.size() - historyWindow);
        return List.copyOf(history.subList(from, history.size()));
    }

    static String buildAnswerPrompt(String query, List<ChatMessage> recent, String documents) {
        String context = recent.stream()
                .map(message -> message.role() + ": " + message.content())
                .collect(Collectors.joining("\n"));

        return """
                You are a helpful assistant that answers user questions.

                Use the retrieved documents and previous conversation context to answer the user's question.
                Base your answer on the documents, don't make up information.
                If the information is not available in the documents, say so clearly.

                - Do provide a clear and concise answer directly addressing the user question.
                - Don't mention the retrieved documents in your answer.
                - Don't output the retrieved documents in your answer unless part of it directly answers the user question.
                - Don't use triple backticks for anything else than code in your answer.

                If you output code:
                - Output the code in a single code block at the end of your answer. Don't include several blocks.
                - Surround code with triple backticks at the beginning and end of the code block.


                Context: %s

                Retrieved Documents:
                %s

                User question: %s
                """.formatted(context, documents, query);
    }
}

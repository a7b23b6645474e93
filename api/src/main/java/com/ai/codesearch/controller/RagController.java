package com.ai.codesearch.controller;

import com.ai.codesearch.dto.RagRequest;
import com.ai.codesearch.dto.RagResponse;
import com.ai.codesearch.dto.SourceDto;
import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.AnswerResult;
import com.ai.codesearch.service.AnswerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Retrieval endpoint: search, hydrate and answer. The client is expected to
 * have passed the query through {@code /api/chain-of-thought} first.
 */
@RestController
@RequestMapping("/api")
public class RagController {

    private static final Logger log = LoggerFactory.getLogger(RagController.class);

    private final AnswerService answerService;

    public RagController(AnswerService answerService) {
        this.answerService = answerService;
    }

    @PostMapping("/rag")
    public ResponseEntity<RagResponse> rag(@RequestBody RagRequest request) {
        if (AssistantErrors.isBlank(request.query())) {
            return ResponseEntity.badRequest().body(RagResponse.failure(AssistantErrors.MISSING_QUERY));
        }
        if (request.metadata() == null || !request.metadata().isComplete()) {
            return ResponseEntity.badRequest().body(RagResponse.failure(AssistantErrors.MISSING_METADATA));
        }

        log.info("[RagController] query='{}', repo={}, version={}, context turns={}",
                truncate(request.query(), 50), request.metadata().repoName(), request.metadata().version(),
                request.context().size());

        try {
            AnswerResult result = answerService.answerWithoutGate(
                    request.query(), request.history(), request.metadata().toFilter());
            return ResponseEntity.ok(RagResponse.ok(
                    result.text(),
                    result.sources().stream().map(SourceDto::from).toList(),
                    request.metadata()));
        } catch (UpstreamUnavailableException | ConfigurationException e) {
            log.error("[RagController] RAG error: {}", e.getMessage());
            return ResponseEntity.status(AssistantErrors.status(e))
                    .body(RagResponse.failure(AssistantErrors.message(e)));
        }
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}

package com.ai.codesearch.controller;

import com.ai.codesearch.dto.AskResponse;
import com.ai.codesearch.dto.RagRequest;
import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.service.AnswerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Full turn in one call: gate, then retrieval and answer when the query is clear.
 */
@RestController
@RequestMapping("/api")
public class AskController {

    private static final Logger log = LoggerFactory.getLogger(AskController.class);

    private final AnswerService answerService;

    public AskController(AnswerService answerService) {
        this.answerService = answerService;
    }

    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@RequestBody RagRequest request) {
        if (AssistantErrors.isBlank(request.query())) {
            return ResponseEntity.badRequest().body(AskResponse.failure(AssistantErrors.MISSING_QUERY));
        }
        if (request.metadata() == null || !request.metadata().isComplete()) {
            return ResponseEntity.badRequest().body(AskResponse.failure(AssistantErrors.MISSING_METADATA));
        }

        try {
            return ResponseEntity.ok(AskResponse.from(
                    answerService.answer(request.query(), request.history(), request.metadata().toFilter())));
        } catch (UpstreamUnavailableException | ConfigurationException e) {
            log.error("[AskController] Ask error: {}", e.getMessage());
            return ResponseEntity.status(AssistantErrors.status(e))
                    .body(AskResponse.failure(AssistantErrors.message(e)));
        }
    }
}

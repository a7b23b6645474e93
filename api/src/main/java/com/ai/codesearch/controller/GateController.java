package com.ai.codesearch.controller;

import com.ai.codesearch.dto.GateResponse;
import com.ai.codesearch.dto.RagRequest;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.GateDecision;
import com.ai.codesearch.service.ClarificationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class GateController {

    private static final Logger log = LoggerFactory.getLogger(GateController.class);

    private final ClarificationGate gate;

    public GateController(ClarificationGate gate) {
        this.gate = gate;
    }

    @PostMapping("/chain-of-thought")
    public ResponseEntity<GateResponse> chainOfThought(@RequestBody RagRequest request) {
        if (AssistantErrors.isBlank(request.query())) {
            return ResponseEntity.badRequest().body(GateResponse.failure(AssistantErrors.MISSING_QUERY));
        }

        try {
            GateDecision decision = gate.gate(request.query(), request.history());
            return ResponseEntity.ok(decision.isProceed()
                    ? GateResponse.proceeding()
                    : GateResponse.clarify(decision.question()));
        } catch (UpstreamUnavailableException e) {
            log.error("[GateController] Chain of thought error: {}", e.getMessage());
            return ResponseEntity.status(AssistantErrors.status(e))
                    .body(GateResponse.failure(AssistantErrors.message(e)));
        }
    }
}

package com.ai.codesearch.controller;

import com.ai.codesearch.dto.IndexRequest;
import com.ai.codesearch.dto.IndexRunResponse;
import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.model.IndexReport;
import com.ai.codesearch.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for repository indexing operations.
 */
@RestController
@RequestMapping("/api/index")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    private final IndexingService indexingService;

    public IndexController(IndexingService indexingService) {
        this.indexingService = indexingService;
    }

    /**
     * Index one or more versions of a repository.
     * POST /api/index
     *
     * Runs synchronously and returns one report per version, unless
     * {@code async} is set, in which case the run ids are returned with 202.
     */
    @PostMapping
    public ResponseEntity<?> index(@RequestBody IndexRequest request) {
        if (request.repoUrl() == null || request.repoUrl().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MISSING_REPO_URL: repoUrl is required");
        }
        if (!request.repoUrl().startsWith("http://") && !request.repoUrl().startsWith("https://")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "INVALID_REPO_URL: repoUrl must be an http(s) URL");
        }

        log.info("[Index] START repo={} versions={} async={}", request.repoUrl(), request.versions(), request.async());

        if (request.async()) {
            List<IndexRun> runs = indexingService.beginRuns(request.repoUrl(), request.versions());
            indexingService.indexRunsAsync(runs);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ACCEPTED");
            body.put("runs", runs.stream().map(IndexRunResponse::from).toList());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }

        List<IndexReport> reports = indexingService.indexRepository(request.repoUrl(), request.versions());
        return ResponseEntity.ok(reports);
    }

    /**
     * GET /api/index/runs
     */
    @GetMapping("/runs")
    public List<IndexRunResponse> runs() {
        return indexingService.listRuns().stream().map(IndexRunResponse::from).toList();
    }

    /**
     * GET /api/index/runs/{repoName}/{version}
     */
    @GetMapping("/runs/{repoName}/{version}")
    public List<IndexRunResponse> runs(@PathVariable String repoName, @PathVariable String version) {
        List<IndexRun> runs = indexingService.listRuns(repoName, version);
        if (runs.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "INDEX_NOT_FOUND: no runs for " + repoName + ":" + version);
        }
        return runs.stream().map(IndexRunResponse::from).toList();
    }

    /**
     * DELETE /api/index/{repoName}/{version}
     */
    @DeleteMapping("/{repoName}/{version}")
    public Map<String, Object> delete(@PathVariable String repoName, @PathVariable String version) {
        long deleted = indexingService.deleteIndex(repoName, version);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("repoName", repoName);
        body.put("version", version);
        body.put("entriesDeleted", deleted);
        return body;
    }
}

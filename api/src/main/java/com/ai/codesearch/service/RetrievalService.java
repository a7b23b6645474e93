package com.ai.codesearch.service;

import com.ai.codesearch.api.GithubRawContentClient;
import com.ai.codesearch.api.GithubUrls;
import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;
import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.HydrationException;
import com.ai.codesearch.model.Chunk;
import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.RetrievalResult;
import com.ai.codesearch.model.RetrievedDocument;
import com.ai.codesearch.model.VectorMatch;
import com.ai.codesearch.repository.IndexRunRepository;
import com.ai.codesearch.service.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Embeds a query, searches one (repository, version) partition, keeps the
 * best-ranked chunk per file and hydrates each file with its full content.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    public static final int TOP_K = 5;
    static final String DOCUMENT_DELIMITER = "\n\n---\n\n";

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final GithubRawContentClient rawContentClient;
    private final IndexRunRepository indexRunRepository;

    public RetrievalService(
            EmbeddingProvider embeddingProvider,
            VectorIndex vectorIndex,
            GithubRawContentClient rawContentClient,
            IndexRunRepository indexRunRepository) {
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.rawContentClient = rawContentClient;
        this.indexRunRepository = indexRunRepository;
    }

    public RetrievalResult retrieve(String query, MetadataFilter filter) {
        log.info("[RetrievalService] Searching {}:{} with query: '{}'", filter.repoName(), filter.version(),
                query.length() > 50 ? query.substring(0, 50) + "..." : query);

        checkIndexModel(filter);

        float[] queryVector = embeddingProvider.embed(query);
        List<VectorMatch> matches = vectorIndex.query(queryVector, filter, TOP_K);
        checkMatchModels(matches);

        List<RetrievedDocument> unique = deduplicate(matches);
        log.info("[RetrievalService] Filtered from {} chunks to {} unique files", matches.size(), unique.size());

        List<RetrievedDocument> hydrated = hydrate(unique);
        long withRaw = hydrated.stream().filter(RetrievedDocument::hasRawContent).count();
        log.info("[RetrievalService] Hydrated {}/{} documents with raw content", withRaw, hydrated.size());

        return new RetrievalResult(hydrated, buildContext(hydrated), matches.size());
    }

    /**
     * First occurrence per file wins, in the index's rank order.
     */
    static List<RetrievedDocument> deduplicate(List<VectorMatch> matches) {
        Map<String, RetrievedDocument> byFile = new LinkedHashMap<>();
        for (VectorMatch match : matches) {
            RetrievedDocument document = toDocument(match);
            byFile.putIfAbsent(fileIdentity(document, match), document);
        }
        return new ArrayList<>(byFile.values());
    }

    private static String fileIdentity(RetrievedDocument document, VectorMatch match) {
        if (!document.originalFileUrl().isEmpty()) {
            return document.originalFileUrl();
        }
        if (!document.sourceFile().isEmpty()) {
            return document.sourceFile();
        }
        return match.id();
    }

    private static RetrievedDocument toDocument(VectorMatch match) {
        String chunkId = match.metadata(IndexEntry.CHUNK_ID);
        if (chunkId.isEmpty()) {
            chunkId = match.id();
        }
        String sourceFile = match.metadata(IndexEntry.SOURCE_FILE);
        if (sourceFile.isEmpty() && chunkId.contains(Chunk.CHUNK_MARKER)) {
            sourceFile = chunkId.substring(0, chunkId.indexOf(Chunk.CHUNK_MARKER));
        }
        return new RetrievedDocument(
                match.score(),
                match.metadata(IndexEntry.TEXT),
                sourceFile,
                chunkId,
                match.metadata(IndexEntry.ORIGINAL_FILE),
                null);
    }

    /**
     * Fetches run concurrently; the result is only assembled once every fetch
     * has settled. A failed fetch leaves its document without raw content.
     */
    List<RetrievedDocument> hydrate(List<RetrievedDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        List<Mono<RetrievedDocument>> fetches = documents.stream()
                .map(this::hydrateOne)
                .toList();
        List<RetrievedDocument> hydrated = Flux.mergeSequential(fetches).collectList().block();
        return hydrated != null ? hydrated : documents;
    }

    private Mono<RetrievedDocument> hydrateOne(RetrievedDocument document) {
        if (!GithubUrls.isBlobUrl(document.originalFileUrl())) {
            return Mono.just(document);
        }
        return rawContentClient.fetch(document.originalFileUrl())
                .map(document::withRawContent)
                .onErrorResume(HydrationException.class, e -> {
                    log.warn("[RetrievalService] {}", e.getMessage());
                    return Mono.just(document);
                });
    }

    static String buildContext(List<RetrievedDocument> documents) {
        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            RetrievedDocument document = documents.get(i);
            StringBuilder block = new StringBuilder()
                    .append("Document ").append(i + 1).append(" (").append(document.sourceFile()).append("):\n")
                    .append(document.content());
            if (document.hasRawContent()) {
                block.append("\n\nFull file content:\n").append(document.rawContent());
            }
            blocks.add(block.toString());
        }
        return String.join(DOCUMENT_DELIMITER, blocks);
    }

    /**
     * Similarity scores are meaningless across embedding models.
     */
    private void checkIndexModel(MetadataFilter filter) {
        Optional<IndexRun> latest = indexRunRepository.findFirstByRepoNameAndVersionAndStatusInOrderByStartedAtDesc(
                filter.repoName(), filter.version(),
                EnumSet.of(IndexRunStatus.COMPLETED, IndexRunStatus.COMPLETED_WITH_ERRORS));
        latest.ifPresent(run -> {
            if (!embeddingProvider.modelName().equals(run.getEmbedModel())) {
                throw new ConfigurationException("Index " + filter.repoName() + ":" + filter.version()
                        + " was built with embedding model " + run.getEmbedModel()
                        + " but the configured model is " + embeddingProvider.modelName() + "; re-index required");
            }
        });
    }

    private void checkMatchModels(List<VectorMatch> matches) {
        String expected = embeddingProvider.modelName();
        String foreign = matches.stream()
                .map(match -> match.metadata(IndexEntry.MODEL))
                .filter(model -> !model.isEmpty() && !model.equals(expected))
                .distinct()
                .collect(Collectors.joining(", "));
        if (!foreign.isEmpty()) {
            throw new ConfigurationException("Index entries were embedded with " + foreign
                    + " but the configured model is " + expected + "; re-index required");
        }
    }
}

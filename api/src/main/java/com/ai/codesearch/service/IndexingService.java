package com.ai.codesearch.service;

import com.ai.codesearch.api.GithubArchiveClient;
import com.ai.codesearch.api.GithubUrls;
import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;
import com.ai.codesearch.exception.IndexingInProgressException;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.ArchiveFile;
import com.ai.codesearch.model.Chunk;
import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.IndexReport;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.SkippedFile;
import com.ai.codesearch.model.SourceFile;
import com.ai.codesearch.repository.IndexRunRepository;
import com.ai.codesearch.service.vector.VectorIndex;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a repository version, chunks its source files, embeds the chunks and
 * upserts them into the vector index.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    static final String INTERRUPTED_MESSAGE = "Interrupted by restart";

    private final GithubArchiveClient archiveClient;
    private final SourceFileSelector fileSelector;
    private final CodeChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final IndexRunRepository indexRunRepository;
    private final CodeSearchProperties.Indexing settings;

    public IndexingService(
            GithubArchiveClient archiveClient,
            SourceFileSelector fileSelector,
            CodeChunker chunker,
            EmbeddingProvider embeddingProvider,
            VectorIndex vectorIndex,
            IndexRunRepository indexRunRepository,
            CodeSearchProperties properties) {
        this.archiveClient = archiveClient;
        this.fileSelector = fileSelector;
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.indexRunRepository = indexRunRepository;
        this.settings = properties.getIndexing();
    }

    /**
     * Index one version synchronously.
     *
     * @throws UpstreamUnavailableException if the archive cannot be fetched; the run is recorded as FAILED
     * @throws IndexingInProgressException  if a run for the same partition has not finished
     */
    public IndexReport indexRepository(String repoUrl, String version) {
        return executeRun(beginRun(repoUrl, version));
    }

    /**
     * Index several versions in turn; an empty list means {@code latest}. A
     * version that fails yields a FAILED report and the remaining versions
     * still run. Versions are trimmed and duplicates collapse into one run.
     */
    public List<IndexReport> indexRepository(String repoUrl, List<String> versions) {
        return executeRuns(beginRuns(repoUrl, versions));
    }

    /**
     * Record IN_PROGRESS runs for every version up front so callers get run ids
     * before any work starts.
     */
    public synchronized List<IndexRun> beginRuns(String repoUrl, List<String> versions) {
        Set<String> effective = new LinkedHashSet<>();
        if (versions != null) {
            versions.forEach(version -> effective.add(normalizeVersion(version)));
        }
        if (effective.isEmpty()) {
            effective.add(GithubUrls.LATEST);
        }

        String repoName = GithubUrls.repoName(repoUrl);
        for (String version : effective) {
            if (indexRunRepository.existsByRepoNameAndVersionAndStatus(repoName, version, IndexRunStatus.IN_PROGRESS)) {
                throw new IndexingInProgressException(repoName, version);
            }
        }

        // all or nothing
        List<IndexRun> runs = new ArrayList<>();
        try {
            for (String version : effective) {
                runs.add(beginRun(repoUrl, version));
            }
        } catch (RuntimeException e) {
            log.error("[IndexingService] Could not record runs for {}: {}", repoName, e.getMessage());
            for (IndexRun run : runs) {
                failQuietly(run, "Run not started: " + e.getMessage());
            }
            throw e;
        }
        return runs;
    }

    /**
     * Runs left IN_PROGRESS by a previous process can never finish and would
     * block their partitions, so they are marked FAILED at startup.
     *
     * @return number of runs recovered
     */
    @PostConstruct
    public int recoverInterruptedRuns() {
        List<IndexRun> stale = indexRunRepository.findAllByStatus(IndexRunStatus.IN_PROGRESS);
        for (IndexRun run : stale) {
            log.warn("[IndexingService] Run {} for {}:{} was interrupted, marking FAILED",
                    run.getId(), run.getRepoName(), run.getVersion());
            markFailed(run, INTERRUPTED_MESSAGE);
        }
        return stale.size();
    }

    @Async
    public CompletableFuture<List<IndexReport>> indexRunsAsync(List<IndexRun> runs) {
        try {
            return CompletableFuture.completedFuture(executeRuns(runs));
        } catch (Exception e) {
            log.error("[IndexingService] Async indexing failed: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    synchronized IndexRun beginRun(String repoUrl, String version) {
        String effectiveVersion = normalizeVersion(version);
        String repoName = GithubUrls.repoName(repoUrl);

        if (indexRunRepository.existsByRepoNameAndVersionAndStatus(repoName, effectiveVersion,
                IndexRunStatus.IN_PROGRESS)) {
            throw new IndexingInProgressException(repoName, effectiveVersion);
        }

        IndexRun run = new IndexRun();
        run.setRepoName(repoName);
        run.setRepoUrl(repoUrl);
        run.setVersion(effectiveVersion);
        run.setStatus(IndexRunStatus.IN_PROGRESS);
        run.setEmbedModel(embeddingProvider.modelName());
        run.setChunkSize(settings.getChunkSize());
        run.setChunkOverlap(settings.getChunkOverlap());
        run.setStartedAt(OffsetDateTime.now());
        return indexRunRepository.save(run);
    }

    private List<IndexReport> executeRuns(List<IndexRun> runs) {
        List<IndexReport> reports = new ArrayList<>();
        for (IndexRun run : runs) {
            try {
                reports.add(executeRun(run));
            } catch (UpstreamUnavailableException e) {
                reports.add(IndexReport.failed(run.getId(), run.getRepoName(), run.getVersion(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[IndexingService] Run {}:{} failed unexpectedly", run.getRepoName(), run.getVersion(), e);
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                if (run.getStatus() == IndexRunStatus.IN_PROGRESS) {
                    failQuietly(run, error);
                }
                reports.add(IndexReport.failed(run.getId(), run.getRepoName(), run.getVersion(), error));
            }
        }
        return reports;
    }

    static String normalizeVersion(String version) {
        return (version == null || version.isBlank()) ? GithubUrls.LATEST : version.trim();
    }

    IndexReport executeRun(IndexRun run) {
        String repoName = run.getRepoName();
        String version = run.getVersion();
        MetadataFilter filter = new MetadataFilter(repoName, version);

        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [INDEXING START] {}:{}", repoName, version);
        log.info("║   Repository: {}", run.getRepoUrl());
        log.info("║   Embedding model: {}", embeddingProvider.modelName());
        log.info("║   Chunk size: {}, Overlap: {}", settings.getChunkSize(), settings.getChunkOverlap());
        log.info("╚══════════════════════════════════════════════════════════════════════════════");

        List<ArchiveFile> files;
        long entriesBefore;
        try {
            files = archiveClient.download(run.getRepoUrl(), version);
            clearIfModelChanged(filter);
            entriesBefore = countEntries(filter);
        } catch (RuntimeException e) {
            log.error("[INDEXING ERROR] Run {}:{} failed before chunking: {}", repoName, version, e.getMessage());
            markFailed(run, e.getMessage());
            throw e;
        }

        try {
            return indexFiles(run, filter, files, entriesBefore);
        } catch (RuntimeException e) {
            log.error("[INDEXING ERROR] Run {}:{} failed: {}", repoName, version, e.getMessage());
            markFailed(run, e.getMessage());
            throw e;
        }
    }

    private IndexReport indexFiles(IndexRun run, MetadataFilter filter, List<ArchiveFile> files, long entriesBefore) {
        String repoName = run.getRepoName();
        String version = run.getVersion();

        List<SkippedFile> skippedFiles = new ArrayList<>();
        List<String> failedChunkIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<Chunk> chunks = new ArrayList<>();

        int eligible = 0;
        int filesIndexed = 0;
        for (ArchiveFile file : files) {
            if (!fileSelector.isEligible(file.path())) {
                continue;
            }
            eligible++;

            Optional<String> text = fileSelector.decode(file.content());
            if (text.isEmpty()) {
                log.warn("[INDEXING] Skipping undecodable file {}", file.path());
                skippedFiles.add(new SkippedFile(file.path(), SkippedFile.Reason.UNDECODABLE, "not valid UTF-8 text"));
                continue;
            }

            try {
                SourceFile sourceFile = new SourceFile(repoName, version, file.path(),
                        GithubUrls.blobUrl(run.getRepoUrl(), version, file.path()), text.get());
                List<Chunk> fileChunks = chunker.chunk(sourceFile, null);
                if (!fileChunks.isEmpty()) {
                    chunks.addAll(fileChunks);
                    filesIndexed++;
                }
            } catch (RuntimeException e) {
                log.warn("[INDEXING] Failed to chunk {}: {}", file.path(), e.getMessage());
                skippedFiles.add(new SkippedFile(file.path(), SkippedFile.Reason.CHUNKING_FAILED, e.getMessage()));
            }
        }

        log.info("[INDEXING] {} files in archive, {} eligible, {} chunks from {} files",
                files.size(), eligible, chunks.size(), filesIndexed);

        if (chunks.isEmpty()) {
            String error = "No indexable chunks found in " + repoName + ":" + version;
            errors.add(error);
            run.setFilesDiscovered(files.size());
            run.setFilesSkipped(skippedFiles.size());
            finish(run, IndexRunStatus.FAILED, 0, 0, entriesBefore, entriesBefore, error);
            return new IndexReport(run.getId(), repoName, version, IndexRunStatus.FAILED, files.size(), eligible,
                    0, 0, entriesBefore, entriesBefore, skippedFiles, failedChunkIds, errors);
        }

        List<List<Chunk>> batches = batch(chunks);
        int chunksIndexed = 0;
        int failedBatches = 0;
        boolean aborted = false;

        for (int i = 0; i < batches.size(); i++) {
            List<Chunk> batch = batches.get(i);

            if (failedBatches >= settings.getMaxFailedBatches()) {
                aborted = true;
                for (List<Chunk> remaining : batches.subList(i, batches.size())) {
                    remaining.forEach(chunk -> failedChunkIds.add(chunk.chunkId()));
                }
                String error = "Aborted after " + failedBatches + " failed batches; "
                        + (batches.size() - i) + " batches not attempted";
                errors.add(error);
                log.error("[INDEXING] {}", error);
                break;
            }

            try {
                List<float[]> vectors = embedWithRetry(batch.stream().map(Chunk::embeddingText).toList());
                List<IndexEntry> entries = new ArrayList<>(batch.size());
                for (int j = 0; j < batch.size(); j++) {
                    entries.add(IndexEntry.of(batch.get(j), vectors.get(j), embeddingProvider.modelName()));
                }
                vectorIndex.upsert(entries);
                chunksIndexed += entries.size();
            } catch (UpstreamUnavailableException e) {
                failedBatches++;
                batch.forEach(chunk -> failedChunkIds.add(chunk.chunkId()));
                errors.add("Batch " + (i + 1) + "/" + batches.size() + " failed (" + e.getService() + "): "
                        + e.getMessage());
                log.error("[INDEXING] Batch {}/{} failed for good: {}", i + 1, batches.size(), e.getMessage());
                continue;
            }

            if ((i + 1) % 10 == 0 || i + 1 == batches.size()) {
                int progress = (int) (((i + 1) * 100.0) / batches.size());
                log.info("[INDEXING PROGRESS] {}/{} batches ({}%), {} chunks indexed",
                        i + 1, batches.size(), progress, chunksIndexed);
                run.setChunksIndexed(chunksIndexed);
                indexRunRepository.save(run);
            }
        }

        long entriesAfter = countEntries(filter);

        IndexRunStatus status;
        if (aborted) {
            status = IndexRunStatus.ABORTED;
        } else if (!skippedFiles.isEmpty() || !failedChunkIds.isEmpty()) {
            status = IndexRunStatus.COMPLETED_WITH_ERRORS;
        } else {
            status = IndexRunStatus.COMPLETED;
        }

        run.setFilesDiscovered(files.size());
        run.setFilesIndexed(filesIndexed);
        run.setFilesSkipped(skippedFiles.size());
        run.setChunksFailed(failedChunkIds.size());
        finish(run, status, chunksIndexed, failedChunkIds.size(), entriesBefore, entriesAfter,
                errors.isEmpty() ? null : String.join("\n", errors));

        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [INDEXING COMPLETE] {}:{}", repoName, version);
        log.info("║   Status: {}", status);
        log.info("║   Files indexed: {}/{} eligible ({} in archive)", filesIndexed, eligible, files.size());
        log.info("║   Skipped files: {}", skippedFiles.size());
        log.info("║   Chunks indexed: {}, failed: {}", chunksIndexed, failedChunkIds.size());
        log.info("║   Index entries: {} -> {}", entriesBefore, entriesAfter);
        log.info("╚══════════════════════════════════════════════════════════════════════════════");

        return new IndexReport(run.getId(), repoName, version, status, files.size(), eligible, filesIndexed,
                chunksIndexed, entriesBefore, entriesAfter, List.copyOf(skippedFiles), List.copyOf(failedChunkIds),
                List.copyOf(errors));
    }

    /**
     * Batches bounded by both text count and total characters. A single chunk
     * larger than the character budget gets a batch of its own.
     */
    List<List<Chunk>> batch(List<Chunk> chunks) {
        List<List<Chunk>> batches = new ArrayList<>();
        List<Chunk> current = new ArrayList<>();
        int chars = 0;
        for (Chunk chunk : chunks) {
            int length = chunk.embeddingText().length();
            if (!current.isEmpty()
                    && (current.size() >= settings.getBatchSize() || chars + length > settings.getMaxBatchChars())) {
                batches.add(current);
                current = new ArrayList<>();
                chars = 0;
            }
            current.add(chunk);
            chars += length;
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    private List<float[]> embedWithRetry(List<String> texts) {
        return Mono.fromCallable(() -> embeddingProvider.embed(texts))
                .retryWhen(Retry.backoff(Math.max(0, settings.getMaxAttempts() - 1), settings.getInitialBackoff())
                        .maxBackoff(settings.getMaxBackoff())
                        .scheduler(Schedulers.boundedElastic())
                        .filter(UpstreamUnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("[INDEXING] Embedding batch failed (attempt {}), retrying: {}",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    /**
     * Counts only feed the report, so a store that cannot answer does not fail the run.
     */
    private long countEntries(MetadataFilter filter) {
        try {
            return vectorIndex.count(filter);
        } catch (UpstreamUnavailableException e) {
            log.warn("[INDEXING] Could not count entries of {}:{}: {}", filter.repoName(), filter.version(),
                    e.getMessage());
            return IndexReport.UNKNOWN_COUNT;
        }
    }

    /**
     * Entries embedded with another model are unusable for the current one.
     */
    private void clearIfModelChanged(MetadataFilter filter) {
        latestCompletedRun(filter.repoName(), filter.version())
                .filter(previous -> !embeddingProvider.modelName().equals(previous.getEmbedModel()))
                .ifPresent(previous -> {
                    log.warn("[INDEXING] {}:{} was indexed with {}, now {}; clearing existing entries",
                            filter.repoName(), filter.version(), previous.getEmbedModel(),
                            embeddingProvider.modelName());
                    vectorIndex.deleteAll(filter);
                });
    }

    private void finish(IndexRun run, IndexRunStatus status, int chunksIndexed, int chunksFailed,
            long entriesBefore, long entriesAfter, String errorMessage) {
        run.setStatus(status);
        run.setChunksIndexed(chunksIndexed);
        run.setChunksFailed(chunksFailed);
        run.setEntriesBefore(entriesBefore < 0 ? null : entriesBefore);
        run.setEntriesAfter(entriesAfter < 0 ? null : entriesAfter);
        run.setErrorMessage(truncate(errorMessage));
        run.setCompletedAt(OffsetDateTime.now());
        indexRunRepository.save(run);
    }

    private void markFailed(IndexRun run, String errorMessage) {
        run.setStatus(IndexRunStatus.FAILED);
        run.setErrorMessage(truncate(errorMessage));
        run.setCompletedAt(OffsetDateTime.now());
        indexRunRepository.save(run);
    }

    private void failQuietly(IndexRun run, String errorMessage) {
        try {
            markFailed(run, errorMessage);
        } catch (RuntimeException e) {
            log.error("[IndexingService] Could not mark run {} as FAILED: {}", run.getId(), e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 4000) {
            return message;
        }
        return message.substring(0, 3997) + "...";
    }

    public Optional<IndexRun> latestCompletedRun(String repoName, String version) {
        return indexRunRepository.findFirstByRepoNameAndVersionAndStatusInOrderByStartedAtDesc(
                repoName, version, EnumSet.of(IndexRunStatus.COMPLETED, IndexRunStatus.COMPLETED_WITH_ERRORS));
    }

    public Optional<IndexRun> latestRun(String repoName, String version) {
        return indexRunRepository.findFirstByRepoNameAndVersionOrderByStartedAtDesc(repoName, version);
    }

    public List<IndexRun> listRuns() {
        return indexRunRepository.findAllByOrderByStartedAtDesc();
    }

    public List<IndexRun> listRuns(String repoName, String version) {
        return indexRunRepository.findAllByRepoNameAndVersionOrderByStartedAtDesc(repoName, version);
    }

    /**
     * Remove every index entry of the partition together with its run records.
     *
     * @return number of index entries removed
     */
    @Transactional
    public long deleteIndex(String repoName, String version) {
        if (indexRunRepository.existsByRepoNameAndVersionAndStatus(repoName, version, IndexRunStatus.IN_PROGRESS)) {
            throw new IndexingInProgressException(repoName, version);
        }
        MetadataFilter filter = new MetadataFilter(repoName, version);
        long entries = vectorIndex.count(filter);
        vectorIndex.deleteAll(filter);
        long runs = indexRunRepository.deleteByRepoNameAndVersion(repoName, version);
        log.info("[IndexingService] Deleted {} entries and {} run records for {}:{}", entries, runs, repoName, version);
        return entries;
    }
}

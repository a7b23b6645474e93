package com.ai.codesearch.model;

import com.ai.codesearch.entity.IndexRunStatus;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one indexing run. Every skipped file and every chunk that could
 * not be embedded or stored is listed.
 *
 * @param filesDiscovered regular files in the archive
 * @param filesEligible   files passing the extension allow-list and skip patterns
 * @param filesIndexed    files that produced at least one chunk
 * @param entriesBefore   partition size before the run, {@link #UNKNOWN_COUNT} if the index could not say
 * @param entriesAfter    partition size after the run, {@link #UNKNOWN_COUNT} if the index could not say
 */
public record IndexReport(
        UUID runId,
        String repoName,
        String version,
        IndexRunStatus status,
        int filesDiscovered,
        int filesEligible,
        int filesIndexed,
        int chunksIndexed,
        long entriesBefore,
        long entriesAfter,
        List<SkippedFile> skippedFiles,
        List<String> failedChunkIds,
        List<String> errors) {

    public static final long UNKNOWN_COUNT = -1L;

    /**
     * Zero when either count is unknown.
     */
    public long netGrowth() {
        if (entriesBefore < 0 || entriesAfter < 0) {
            return 0L;
        }
        return entriesAfter - entriesBefore;
    }

    public static IndexReport failed(UUID runId, String repoName, String version, String error) {
        return new IndexReport(runId, repoName, version, IndexRunStatus.FAILED,
                0, 0, 0, 0, 0, 0, List.of(), List.of(), List.of(error));
    }
}

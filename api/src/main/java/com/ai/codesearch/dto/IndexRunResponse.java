package com.ai.codesearch.dto;

import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IndexRunResponse(
        UUID id,
        String repoName,
        String repoUrl,
        String version,
        IndexRunStatus status,
        String embedModel,
        Integer filesDiscovered,
        Integer filesIndexed,
        Integer filesSkipped,
        Integer chunksIndexed,
        Integer chunksFailed,
        Long entriesBefore,
        Long entriesAfter,
        String errorMessage,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt) {

    public static IndexRunResponse from(IndexRun run) {
        return new IndexRunResponse(
                run.getId(),
                run.getRepoName(),
                run.getRepoUrl(),
                run.getVersion(),
                run.getStatus(),
                run.getEmbedModel(),
                run.getFilesDiscovered(),
                run.getFilesIndexed(),
                run.getFilesSkipped(),
                run.getChunksIndexed(),
                run.getChunksFailed(),
                run.getEntriesBefore(),
                run.getEntriesAfter(),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getCompletedAt());
    }
}

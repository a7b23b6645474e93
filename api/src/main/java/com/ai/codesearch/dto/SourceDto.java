package com.ai.codesearch.dto;

import com.ai.codesearch.model.RetrievedDocument;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Citation of one retrieved file.
 */
public record SourceDto(
        String file,
        double score,
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("original_file") String originalFile,
        @JsonProperty("has_raw_content") boolean hasRawContent) {

    public static SourceDto from(RetrievedDocument document) {
        return new SourceDto(
                document.sourceFile(),
                document.score(),
                document.chunkId(),
                document.originalFileUrl(),
                document.hasRawContent());
    }
}

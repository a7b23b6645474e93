package com.ai.codesearch.model;

/**
 * Deduplicated match, optionally hydrated with the full raw file content.
 */
public record RetrievedDocument(
        double score,
        String content,
        String sourceFile,
        String chunkId,
        String originalFileUrl,
        String rawContent) {

    public boolean hasRawContent() {
        return rawContent != null && !rawContent.isEmpty();
    }

    public RetrievedDocument withRawContent(String raw) {
        return new RetrievedDocument(score, content, sourceFile, chunkId, originalFileUrl, raw);
    }
}

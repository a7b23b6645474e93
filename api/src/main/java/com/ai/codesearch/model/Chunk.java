package com.ai.codesearch.model;

/**
 * Contiguous slice of a source file at an indexed version.
 *
 * @param chunkId         {@code <sourceFile>_<chunk>_<index>}, stable for an unchanged file
 * @param startOffset     inclusive character offset into the file text
 * @param endOffset       exclusive character offset into the file text
 */
public record Chunk(
        String chunkId,
        String text,
        String sourceFile,
        String originalFileUrl,
        String repoName,
        String version,
        int index,
        int startOffset,
        int endOffset) {

    public static final String CHUNK_MARKER = "_<chunk>_";

    public static String chunkId(String sourceFile, int index) {
        return sourceFile + CHUNK_MARKER + index;
    }

    /**
     * Identifier of the index entry, unique across repositories and versions.
     */
    public String vectorId() {
        return vectorIdPrefix(repoName, version) + chunkId;
    }

    /**
     * Common prefix of every entry id in a repository version.
     */
    public static String vectorIdPrefix(String repoName, String version) {
        return repoName + ":" + version + ":";
    }

    /**
     * Text handed to the embedding model: the file path followed by the chunk.
     */
    public String embeddingText() {
        return sourceFile + "\n" + text;
    }
}

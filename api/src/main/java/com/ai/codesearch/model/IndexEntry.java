package com.ai.codesearch.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vector plus metadata as stored in the vector index.
 */
public record IndexEntry(String id, float[] vector, Map<String, String> metadata) {

    public static final String SOURCE_FILE = "source_file";
    public static final String ORIGINAL_FILE = "original_file";
    public static final String CHUNK_ID = "chunk_id";
    public static final String TEXT = "text";
    public static final String MODEL = "model";

    public static IndexEntry of(Chunk chunk, float[] vector, String model) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(MetadataFilter.REPO_NAME, chunk.repoName());
        metadata.put(MetadataFilter.VERSION, chunk.version());
        metadata.put(SOURCE_FILE, chunk.sourceFile());
        metadata.put(ORIGINAL_FILE, chunk.originalFileUrl());
        metadata.put(CHUNK_ID, chunk.chunkId());
        metadata.put(TEXT, chunk.text());
        metadata.put(MODEL, model);
        return new IndexEntry(chunk.vectorId(), vector, Map.copyOf(metadata));
    }
}

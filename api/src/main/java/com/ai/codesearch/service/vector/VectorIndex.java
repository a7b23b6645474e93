package com.ai.codesearch.service.vector;

import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.VectorMatch;

import java.util.List;

/**
 * Vector store holding the index entries of every repository and version.
 * Implementations are built once and shared across concurrent requests.
 */
public interface VectorIndex {

    /**
     * Inserts or overwrites entries by id. Re-upserting an existing id never
     * creates a second entry.
     */
    void upsert(List<IndexEntry> entries);

    /**
     * Returns at most {@code topK} matches restricted to the filter's
     * partition, in descending score order.
     */
    List<VectorMatch> query(float[] vector, MetadataFilter filter, int topK);

    long count(MetadataFilter filter);

    void deleteAll(MetadataFilter filter);
}

package com.ai.codesearch.service.vector;

import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.VectorMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryVectorIndexTest {

    private static final MetadataFilter MODAL_V1 = new MetadataFilter("modal-client", "v1");

    private static IndexEntry entry(String id, String repo, String version, float... vector) {
        return new IndexEntry(id, vector, Map.of(MetadataFilter.REPO_NAME, repo, MetadataFilter.VERSION, version));
    }

    @Test
    void testUpsert_SameIdReplaces() {
        // Arrange
        InMemoryVectorIndex index = new InMemoryVectorIndex();

        // Act
        index.upsert(List.of(entry("a", "modal-client", "v1", 1f, 0f)));
        index.upsert(List.of(entry("a", "modal-client", "v1", 0f, 1f)));

        // Assert
        assertEquals(1, index.count(MODAL_V1));
        assertEquals(1.0, index.query(new float[]{0f, 1f}, MODAL_V1, 5).get(0).score(), 1e-6);
    }

    @Test
    void testQuery_FilteredAndOrderedByScore() {
        // Arrange
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(List.of(
                entry("far", "modal-client", "v1", 0f, 1f),
                entry("near", "modal-client", "v1", 1f, 0.1f),
                entry("other-version", "modal-client", "v2", 1f, 0f),
                entry("other-repo", "other", "v1", 1f, 0f)));

        // Act
        List<VectorMatch> matches = index.query(new float[]{1f, 0f}, MODAL_V1, 5);

        // Assert
        assertEquals(List.of("near", "far"), matches.stream().map(VectorMatch::id).toList());
        assertTrue(matches.get(0).score() > matches.get(1).score());
    }

    @Test
    void testQuery_TopKLimit() {
        // Arrange
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        for (int i = 0; i < 8; i++) {
            index.upsert(List.of(entry("e" + i, "modal-client", "v1", 1f, i)));
        }

        // Act & Assert
        assertEquals(5, index.query(new float[]{1f, 0f}, MODAL_V1, 5).size());
    }

    @Test
    void testDeleteAll_OnlyPartition() {
        // Arrange
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.upsert(List.of(entry("a", "modal-client", "v1", 1f), entry("b", "modal-client", "v2", 1f)));

        // Act
        index.deleteAll(MODAL_V1);

        // Assert
        assertEquals(0, index.count(MODAL_V1));
        assertEquals(1, index.count(new MetadataFilter("modal-client", "v2")));
    }

    @Test
    void testCosineSimilarity() {
        assertEquals(1.0, InMemoryVectorIndex.cosineSimilarity(new float[]{2f, 0f}, new float[]{1f, 0f}), 1e-9);
        assertEquals(0.0, InMemoryVectorIndex.cosineSimilarity(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-9);
        assertEquals(0.0, InMemoryVectorIndex.cosineSimilarity(new float[]{1f}, new float[]{1f, 0f}), 1e-9);
        assertEquals(0.0, InMemoryVectorIndex.cosineSimilarity(new float[]{0f, 0f}, new float[]{1f, 0f}), 1e-9);
    }
}

package com.ai.codesearch.service.vector;

import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local index using cosine similarity. Default for local runs and tests.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void upsert(List<IndexEntry> batch) {
        for (IndexEntry entry : batch) {
            entries.put(entry.id(), entry);
        }
        log.debug("[InMemoryVectorIndex] Upserted {} entries, {} total", batch.size(), entries.size());
    }

    @Override
    public List<VectorMatch> query(float[] vector, MetadataFilter filter, int topK) {
        return entries.values().stream()
                .filter(entry -> filter.matches(entry.metadata()))
                .map(entry -> new VectorMatch(entry.id(), cosineSimilarity(vector, entry.vector()), entry.metadata()))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed()
                        .thenComparing(VectorMatch::id))
                .limit(topK)
                .toList();
    }

    @Override
    public long count(MetadataFilter filter) {
        return entries.values().stream()
                .filter(entry -> filter.matches(entry.metadata()))
                .count();
    }

    @Override
    public void deleteAll(MetadataFilter filter) {
        entries.values().removeIf(entry -> filter.matches(entry.metadata()));
    }

    static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0d;
        }
        double dot = 0d;
        double normA = 0d;
        double normB = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0d || normB == 0d) {
            return 0d;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

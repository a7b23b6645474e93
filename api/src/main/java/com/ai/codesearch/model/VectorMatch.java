package com.ai.codesearch.model;

import java.util.Map;

/**
 * Single hit returned by a vector query, in descending score order.
 */
public record VectorMatch(String id, double score, Map<String, String> metadata) {

    public String metadata(String key) {
        if (metadata == null) {
            return "";
        }
        String value = metadata.get(key);
        return value != null ? value : "";
    }
}

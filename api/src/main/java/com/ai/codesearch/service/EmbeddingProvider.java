package com.ai.codesearch.service;

import java.util.List;

/**
 * Text embedding capability shared by the indexing and retrieval sides. The
 * single configured instance is the only source of the embedding model name.
 */
public interface EmbeddingProvider {

    /**
     * One vector per input text, in input order.
     */
    List<float[]> embed(List<String> texts);

    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }

    String modelName();

    int dimension();
}

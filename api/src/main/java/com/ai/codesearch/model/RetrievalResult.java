package com.ai.codesearch.model;

import java.util.List;

/**
 * @param candidateCount number of matches returned by the index before deduplication
 */
public record RetrievalResult(List<RetrievedDocument> documents, String contextText, int candidateCount) {
}

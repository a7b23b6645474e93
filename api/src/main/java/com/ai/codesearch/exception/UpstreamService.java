package com.ai.codesearch.exception;

/**
 * External collaborators whose failure is fatal to the current request or run.
 */
public enum UpstreamService {
    EMBEDDING,
    VECTOR_INDEX,
    COMPLETION,
    ARCHIVE
}

package com.ai.codesearch.entity;

/**
 * Lifecycle of one indexing run.
 */
public enum IndexRunStatus {
    IN_PROGRESS,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    /**
     * Stopped after too many embedding batches failed for good.
     */
    ABORTED,
    FAILED;

    public boolean isCompleted() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS;
    }
}

package com.ai.codesearch.model;

public record SkippedFile(String path, Reason reason, String detail) {

    public enum Reason {
        /**
         * Not valid UTF-8 or contains NUL bytes.
         */
        UNDECODABLE,
        CHUNKING_FAILED
    }
}

package com.ai.codesearch.exception;

/**
 * Raw file content could not be fetched. Never fatal: the document is kept
 * with its indexed chunk text only.
 */
public class HydrationException extends Exception {

    private final String url;

    public HydrationException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}

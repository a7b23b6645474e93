package com.ai.codesearch.exception;

/**
 * Thrown when an embedding, vector-index, completion or archive call fails or
 * times out.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final UpstreamService service;

    public UpstreamUnavailableException(UpstreamService service, String message) {
        super(message);
        this.service = service;
    }

    public UpstreamUnavailableException(UpstreamService service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public UpstreamService getService() {
        return service;
    }
}

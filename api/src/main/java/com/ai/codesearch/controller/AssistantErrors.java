package com.ai.codesearch.controller;

import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import org.springframework.http.HttpStatus;

/**
 * User-facing messages for failures of the conversational endpoints.
 */
final class AssistantErrors {

    static final String MISSING_QUERY = "Query is required";
    static final String MISSING_METADATA = "Metadata with repo_name and version is required";

    private AssistantErrors() {
    }

    static HttpStatus status(RuntimeException e) {
        if (e instanceof UpstreamUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static String message(RuntimeException e) {
        if (e instanceof UpstreamUnavailableException upstream) {
            return switch (upstream.getService()) {
                case EMBEDDING -> "The embedding service is unavailable, please try again later.";
                case VECTOR_INDEX -> "The code index is unavailable, please try again later.";
                case COMPLETION -> "The language model is unavailable, please try again later.";
                case ARCHIVE -> "The repository archive could not be fetched.";
            };
        }
        if (e instanceof ConfigurationException) {
            return "The search service is misconfigured: " + e.getMessage();
        }
        return "Failed to process the request.";
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

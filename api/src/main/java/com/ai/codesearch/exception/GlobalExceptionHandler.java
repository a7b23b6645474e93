package com.ai.codesearch.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ApiError> handleUpstreamUnavailable(UpstreamUnavailableException e, WebRequest request) {
        log.error("[ExceptionHandler] Upstream {} unavailable: {}", e.getService(), e.getMessage());

        ApiError error = new ApiError(
                OffsetDateTime.now(),
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                "UPSTREAM_UNAVAILABLE",
                e.getMessage(),
                getRequestPath(request),
                Map.of("service", e.getService().name()));

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException e, WebRequest request) {
        log.error("[ExceptionHandler] Configuration error: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "CONFIGURATION_ERROR",
                e.getMessage(),
                getRequestPath(request));

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(IndexingInProgressException.class)
    public ResponseEntity<ApiError> handleIndexingInProgress(IndexingInProgressException e, WebRequest request) {
        log.warn("[ExceptionHandler] {}", e.getMessage());

        ApiError error = new ApiError(
                OffsetDateTime.now(),
                HttpStatus.CONFLICT.value(),
                "Conflict",
                "INDEX_IN_PROGRESS",
                e.getMessage(),
                getRequestPath(request),
                Map.of("repo_name", e.getRepoName(), "version", e.getVersion()));

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e, WebRequest request) {
        log.error("[ExceptionHandler] ResponseStatusException: status={}, reason={}", e.getStatusCode(), e.getReason());

        String code = e.getReason();
        if (code != null && code.contains(":")) {
            code = code.split(":")[0].trim();
        }

        ApiError error = ApiError.of(
                e.getStatusCode().value(),
                HttpStatus.valueOf(e.getStatusCode().value()).getReasonPhrase(),
                (code != null && !code.isBlank()) ? code : "API_ERROR",
                e.getReason() != null ? e.getReason() : e.getMessage(),
                getRequestPath(request));

        return ResponseEntity.status(e.getStatusCode()).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e, WebRequest request) {
        log.error("[ExceptionHandler] HttpMessageNotReadableException: {}", e.getMessage());

        ApiError error = new ApiError(
                OffsetDateTime.now(),
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                "INVALID_PAYLOAD",
                "Invalid request payload.",
                getRequestPath(request),
                Map.of("details", String.valueOf(e.getMostSpecificCause().getMessage())));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);

        ApiError error = ApiError.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred.",
                getRequestPath(request));

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return null;
    }
}

package com.ai.codesearch.exception;

/**
 * Missing credential or model id, or an index built with a different embedding
 * model than the one currently configured.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}

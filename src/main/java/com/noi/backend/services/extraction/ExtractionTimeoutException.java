package com.noi.backend.services.extraction;

/**
 * Transient model failure (call timeout or rate limit). Retried with backoff.
 */
public class ExtractionTimeoutException extends ExtractionException {

    public ExtractionTimeoutException(String message) {
        super(message);
    }

    public ExtractionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.noi.backend.services.extraction;

/**
 * Base type for failures inside the extraction pipeline. None of these reach the caller of
 * {@link FinancialExtractionPipeline}; they become statuses and warnings on the result.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

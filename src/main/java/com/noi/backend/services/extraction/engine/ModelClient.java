package com.noi.backend.services.extraction.engine;

/**
 * Semantic extraction service seen by the engine.
 *
 * Implementations throw {@link com.noi.backend.services.extraction.ExtractionTimeoutException} for
 * transient failures and {@link com.noi.backend.services.extraction.ModelCallException} for the rest.
 */
public interface ModelClient {

    boolean isAvailable();

    String complete(String prompt, double temperature);
}

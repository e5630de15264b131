package com.noi.backend.services.extraction;

/**
 * Model output that does not carry the primary metric keys.
 */
public class SchemaMismatchException extends ExtractionException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}

package com.noi.backend.services.extraction;

/**
 * Thrown by the format readers when the bytes cannot be read as the resolved format.
 */
public class UnsupportedFormatException extends ExtractionException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

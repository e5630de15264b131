package com.noi.backend.services.extraction;

public class ModelCallException extends ExtractionException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.noi.backend.enums;

/**
 * Terminal outcome of one document run. The first two carry a record, the rest are diagnostics.
 */
public enum ExtractionStatus {
    EXTRACTED,
    UNCERTAIN,
    NO_FINANCIAL_CONTENT,
    UNSUPPORTED_FORMAT,
    CANCELLED;

    public boolean hasRecord() {
        return this == EXTRACTED || this == UNCERTAIN;
    }
}

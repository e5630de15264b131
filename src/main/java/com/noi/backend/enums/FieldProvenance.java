package com.noi.backend.enums;

/**
 * Where a field value came from. Drives the per-field confidence rules.
 */
public enum FieldProvenance {
    /** Returned by the model and found verbatim on a source line. */
    MODEL_EXTRACTED,
    /** Returned by the model without a matching source line (estimate). */
    MODEL_INFERRED,
    /** Found by the deterministic label/amount scan. */
    PATTERN_FALLBACK,
    /** Produced or overwritten by the consistency validator. */
    CALCULATED,
    /** No value. */
    UNRESOLVED
}

package com.noi.backend.enums;

public enum ExtractionMethod {
    MODEL,
    PATTERN_FALLBACK,
    NONE
}

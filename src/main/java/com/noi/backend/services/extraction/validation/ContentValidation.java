package com.noi.backend.services.extraction.validation;

/**
 * Outcome of the financial-content gate.
 */
public record ContentValidation(boolean hasFinancialContent, String reason, int materialValues, int keywordAdjacentValues) {
}

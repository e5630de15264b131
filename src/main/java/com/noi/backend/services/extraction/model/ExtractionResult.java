package com.noi.backend.services.extraction.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.noi.backend.enums.ConfidenceLevel;
import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.enums.DocumentRole;
import com.noi.backend.enums.ExtractionMethod;
import com.noi.backend.enums.ExtractionStatus;
import com.noi.backend.enums.FieldProvenance;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Output of one pipeline run. Diagnostics (no financial content, unsupported format, cancelled)
 * carry no record and are never confused with an uncertain extraction.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionResult {

    private final ExtractionStatus status;
    private final String message;

    private final FinancialRecord record;
    private final Map<String, Double> fieldConfidence;
    private final Map<String, FieldProvenance> provenance;
    private final ConfidenceLevel overallConfidence;
    private final double overallScore;

    private final AuditTrail auditTrail;
    private final long processingTimeMs;

    @Singular
    private final List<String> warnings;

    private final String filename;
    private final DocumentRole role;
    private final DocumentFormat format;
    private final String period;
    private final ExtractionMethod method;
    private final int modelCallCount;

    @Singular
    private final List<ExtractionAttempt> attempts;

    public boolean hasRecord() {
        return record != null && status != null && status.hasRecord();
    }
}

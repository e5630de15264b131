package com.noi.backend.services.extraction.scoring;

import java.util.LinkedHashMap;
import java.util.Map;

import com.noi.backend.enums.ConfidenceLevel;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.model.FinancialField;

/**
 * Per-field scores, final provenance and the overall level.
 */
public record ConfidenceReport(Map<FinancialField, Double> scores, Map<FinancialField, FieldProvenance> provenance,
        double overallScore, ConfidenceLevel level) {

    public double scoreOf(FinancialField field) {
        Double s = scores.get(field);
        return s == null ? 0.0 : s;
    }

    public Map<String, Double> scoresByKey() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (FinancialField f : FinancialField.values()) {
            out.put(f.getKey(), scoreOf(f));
        }
        return out;
    }

    public Map<String, FieldProvenance> provenanceByKey() {
        Map<String, FieldProvenance> out = new LinkedHashMap<>();
        for (FinancialField f : FinancialField.values()) {
            FieldProvenance p = provenance.get(f);
            out.put(f.getKey(), p == null ? FieldProvenance.UNRESOLVED : p);
        }
        return out;
    }
}

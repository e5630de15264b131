package com.noi.backend.services.extraction.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed-schema record of nullable monetary values, keyed by {@link FinancialField}.
 *
 * Unsigned fields are normalized to magnitudes on write. Values are kept at scale 2.
 */
public class FinancialRecord {

    private final EnumMap<FinancialField, BigDecimal> values = new EnumMap<>(FinancialField.class);

    public BigDecimal get(FinancialField field) {
        return values.get(field);
    }

    public boolean has(FinancialField field) {
        return values.get(field) != null;
    }

    public void set(FinancialField field, BigDecimal value) {
        if (value == null) {
            values.remove(field);
            return;
        }
        BigDecimal v = value.setScale(2, RoundingMode.HALF_UP);
        if (!field.isSigned() && v.signum() < 0) {
            v = v.negate();
        }
        values.put(field, v);
    }

    public BigDecimal getOrZero(FinancialField field) {
        BigDecimal v = values.get(field);
        return v == null ? BigDecimal.ZERO : v;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int populatedCount() {
        return values.size();
    }

    /**
     * True when at least one of GPR, EGI, OpEx, NOI is present and nonzero.
     */
    public boolean hasNonZeroPrimaryMetric() {
        for (FinancialField f : FinancialField.PRIMARY_METRICS) {
            BigDecimal v = values.get(f);
            if (v != null && v.signum() != 0) return true;
        }
        return false;
    }

    public FinancialRecord copy() {
        FinancialRecord out = new FinancialRecord();
        out.values.putAll(values);
        return out;
    }

    /**
     * Every schema key in declaration order, null for missing values.
     */
    @JsonValue
    public Map<String, BigDecimal> asMap() {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (FinancialField f : FinancialField.values()) {
            out.put(f.getKey(), values.get(f));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FinancialRecord)) return false;
        return values.equals(((FinancialRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FinancialRecord" + values;
    }
}

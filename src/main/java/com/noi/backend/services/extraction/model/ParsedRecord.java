package com.noi.backend.services.extraction.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.noi.backend.enums.FieldProvenance;

/**
 * A record plus where each value came from and which schema keys the source mentioned.
 */
public class ParsedRecord {

    private final FinancialRecord record;
    private final EnumMap<FinancialField, FieldProvenance> provenance = new EnumMap<>(FinancialField.class);
    private final EnumSet<FinancialField> keysSeen = EnumSet.noneOf(FinancialField.class);

    public ParsedRecord() {
        this(new FinancialRecord());
    }

    public ParsedRecord(FinancialRecord record) {
        this.record = record;
    }

    public static ParsedRecord empty() {
        return new ParsedRecord();
    }

    public FinancialRecord getRecord() {
        return record;
    }

    public void put(FinancialField field, BigDecimal value, FieldProvenance source) {
        keysSeen.add(field);
        record.set(field, value);
        if (value == null) {
            provenance.remove(field);
        } else {
            provenance.put(field, source);
        }
    }

    /** Marks a key as present in the source even though its value was null. */
    public void markSeen(FinancialField field) {
        keysSeen.add(field);
    }

    public FieldProvenance provenanceOf(FinancialField field) {
        if (!record.has(field)) return FieldProvenance.UNRESOLVED;
        FieldProvenance p = provenance.get(field);
        return p == null ? FieldProvenance.UNRESOLVED : p;
    }

    public void setProvenance(FinancialField field, FieldProvenance source) {
        provenance.put(field, source);
    }

    public Map<FinancialField, FieldProvenance> getProvenance() {
        return Collections.unmodifiableMap(provenance);
    }

    public Set<FinancialField> getKeysSeen() {
        return Collections.unmodifiableSet(keysSeen);
    }

    /** All four primary metric keys present, with a number or an explicit null. */
    public boolean isSchemaValid() {
        return keysSeen.containsAll(FinancialField.PRIMARY_METRICS);
    }

    public boolean isEmpty() {
        return record.isEmpty();
    }
}

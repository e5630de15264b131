package com.noi.backend.services.extraction.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one consistency pass changed (repairs) and what it only flagged (warnings).
 */
public class ConsistencyReport {

    private final List<String> repairs = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void repaired(String detail) {
        repairs.add(detail);
    }

    void warn(String detail) {
        warnings.add(detail);
    }

    public List<String> getRepairs() {
        return Collections.unmodifiableList(repairs);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean changedRecord() {
        return !repairs.isEmpty();
    }
}

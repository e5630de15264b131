package com.noi.backend.services.extraction.model;

import java.time.Instant;

public record AuditEntry(Instant timestamp, String step, String detail) {

    @Override
    public String toString() {
        return "[" + step + "] " + detail;
    }
}

package com.noi.backend.services.extraction.model;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Append-only log of pipeline steps for one document.
 */
public class AuditTrail {

    private final List<AuditEntry> entries = new ArrayList<>();
    private final Clock clock;

    public AuditTrail() {
        this(Clock.systemUTC());
    }

    public AuditTrail(Clock clock) {
        this.clock = clock;
    }

    public synchronized void record(String step, String detail) {
        entries.add(new AuditEntry(Instant.now(clock), step, detail == null ? "" : detail));
    }

    public synchronized void record(String step, String format, Object... args) {
        record(step, String.format(format, args));
    }

    @JsonValue
    public synchronized List<AuditEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized List<String> steps() {
        List<String> out = new ArrayList<>(entries.size());
        for (AuditEntry e : entries) {
            out.add(e.step());
        }
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean contains(String step) {
        for (AuditEntry e : entries) {
            if (e.step().equals(step)) return true;
        }
        return false;
    }
}

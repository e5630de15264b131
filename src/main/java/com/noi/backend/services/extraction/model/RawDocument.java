package com.noi.backend.services.extraction.model;

import com.noi.backend.enums.DocumentRole;

/**
 * One uploaded document, alive for a single pipeline run.
 *
 * @param formatHint optional extension or MIME type ("xlsx", "text/csv", ...)
 */
public record RawDocument(byte[] bytes, String filename, DocumentRole declaredRole, String formatHint) {

    public RawDocument {
        bytes = bytes == null ? new byte[0] : bytes;
        filename = filename == null || filename.isBlank() ? "document" : filename.trim();
    }

    public RawDocument(byte[] bytes, String filename, DocumentRole declaredRole) {
        this(bytes, filename, declaredRole, null);
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return "RawDocument{filename=" + filename + ", role=" + declaredRole + ", bytes=" + bytes.length
                + ", formatHint=" + formatHint + "}";
    }
}

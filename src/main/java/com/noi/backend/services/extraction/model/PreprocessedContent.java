package com.noi.backend.services.extraction.model;

import java.util.List;

import com.noi.backend.enums.DocumentFormat;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Format-normalized view of a document: prompt-ready text plus structure hints.
 *
 * Never holds the original bytes.
 */
@Getter
@Builder(toBuilder = true)
public class PreprocessedContent {

    public static final String DOCUMENT_END = "[DOCUMENT_END]";

    private final DocumentFormat format;
    private final String filename;

    /** Document banner, e.g. "CSV DOCUMENT: rent.csv". Kept apart from the body so it is never scanned for figures. */
    private final String header;

    /** Marked-up content: sheets, pages, sections. */
    private final String body;

    @Singular
    private final List<LineItem> lineItems;

    /** True when at least one table was rendered as category: value pairs. */
    private final boolean financialStatementFormat;

    @Singular
    private final List<String> structureIndicators;

    /** Set when the bytes could not be read; the content is then empty but valid. */
    private final String failureReason;

    public boolean isReadable() {
        return failureReason == null;
    }

    public boolean hasLineItems() {
        return lineItems != null && !lineItems.isEmpty();
    }

    public String promptText() {
        StringBuilder sb = new StringBuilder();
        if (header != null && !header.isBlank()) {
            sb.append(header).append('\n');
        }
        if (body != null && !body.isBlank()) {
            sb.append(body).append('\n');
        }
        sb.append(DOCUMENT_END);
        return sb.toString();
    }

    public String bodyOrEmpty() {
        return body == null ? "" : body;
    }

    public static PreprocessedContent unreadable(DocumentFormat format, String filename, String reason) {
        return PreprocessedContent.builder()
                .format(format == null ? DocumentFormat.UNKNOWN : format)
                .filename(filename)
                .header("")
                .body("")
                .financialStatementFormat(false)
                .failureReason(reason == null || reason.isBlank() ? "Unreadable document" : reason)
                .build();
    }

    public String getDescription() {
        return String.format(
                "PreprocessedContent{format=%s, bodyChars=%d, lineItems=%d, statementFormat=%s, readable=%s}",
                format,
                bodyOrEmpty().length(),
                lineItems == null ? 0 : lineItems.size(),
                financialStatementFormat,
                isReadable());
    }
}

package com.noi.backend.services.extraction.util;

import java.text.Normalizer;
import java.util.Locale;

public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Lowercase, accents stripped, dashes and non-breaking spaces unified, whitespace collapsed.
     */
    public static String normalizeLabel(String value) {
        if (value == null) return "";
        String s = Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        s = s.replace('\u00A0', ' ')
                .replace('\u2013', '-')
                .replace('\u2014', '-')
                .replace('\u2212', '-');
        return s.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * Cell text for rendering: trimmed, internal whitespace collapsed, never null.
     */
    public static String cleanCell(String value) {
        if (value == null) return "";
        return value.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) return "";
        if (maxChars <= 0 || value.length() <= maxChars) return value;
        return value.substring(0, maxChars) + "...";
    }
}

package com.noi.backend.services.extraction.parsing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.util.TextNormalizer;

/**
 * Finds field labels inside free text. When several synonyms match, the longest wins, so
 * "Net Rental Income" is EGI and not the "rental income" of GPR.
 */
public final class FieldLabelMatcher {

    private static final List<LabelPattern> PATTERNS = buildPatterns();

    private FieldLabelMatcher() {
    }

    /**
     * Longest label in the line, or null.
     */
    public static LabelMatch find(String line) {
        if (line == null || line.isBlank()) return null;
        String normalized = TextNormalizer.normalizeLabel(line);
        for (LabelPattern p : PATTERNS) {
            Matcher m = p.pattern.matcher(normalized);
            if (m.find()) {
                return new LabelMatch(p.field, p.synonym, m.start(), m.end());
            }
        }
        return null;
    }

    /**
     * True when the line mentions any synonym of the given field.
     */
    public static boolean mentions(String line, FinancialField field) {
        if (line == null || line.isBlank()) return false;
        String normalized = TextNormalizer.normalizeLabel(line);
        for (LabelPattern p : PATTERNS) {
            if (p.field == field && p.pattern.matcher(normalized).find()) return true;
        }
        return false;
    }

    private static List<LabelPattern> buildPatterns() {
        List<LabelPattern> out = new ArrayList<>();
        for (FinancialField f : FinancialField.values()) {
            List<String> labels = new ArrayList<>(f.getSynonyms());
            labels.add(f.getLabel());
            for (String synonym : labels) {
                String s = TextNormalizer.normalizeLabel(synonym);
                Pattern p = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(s) + "(?![a-z0-9])");
                out.add(new LabelPattern(f, s, p));
            }
        }
        out.sort(Comparator.comparingInt((LabelPattern p) -> p.synonym.length()).reversed());
        return List.copyOf(out);
    }

    /**
     * Offsets refer to {@link TextNormalizer#normalizeLabel(String)} of the searched line.
     */
    public record LabelMatch(FinancialField field, String synonym, int start, int end) {
    }

    private record LabelPattern(FinancialField field, String synonym, Pattern pattern) {
    }
}

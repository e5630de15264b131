package com.noi.backend.services.extraction.util;

import java.util.List;
import java.util.Locale;

/**
 * Keyword lists shared by the preprocessor and the content gate.
 */
public final class FinancialKeywords {

    /** Labels that mark a row or line as financial. */
    public static final List<String> FINANCIAL = List.of(
            "rent", "income", "revenue", "expense", "tax", "insurance", "maintenance", "utilities",
            "management", "parking", "laundry", "fee", "noi", "egi", "operating", "total", "vacancy",
            "concession", "debt", "payroll", "repairs", "marketing", "administrative");

    /** Words typical of a spreadsheet header row. */
    public static final List<String> HEADER = List.of(
            "total", "income", "expense", "revenue", "cost", "date", "period", "month", "year",
            "budget", "actual", "category", "description", "account", "amount");

    private FinancialKeywords() {
    }

    public static boolean containsFinancialTerm(String text) {
        return containsAny(text, FINANCIAL);
    }

    public static int countFinancialTerms(String text) {
        if (text == null) return 0;
        String t = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String k : FINANCIAL) {
            if (t.contains(k)) hits++;
        }
        return hits;
    }

    public static boolean containsHeaderTerm(String text) {
        return containsAny(text, HEADER);
    }

    private static boolean containsAny(String text, List<String> words) {
        if (text == null || text.isBlank()) return false;
        String t = text.toLowerCase(Locale.ROOT);
        for (String w : words) {
            if (t.contains(w)) return true;
        }
        return false;
    }
}

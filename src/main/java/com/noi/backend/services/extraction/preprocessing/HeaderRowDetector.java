package com.noi.backend.services.extraction.preprocessing;

import java.util.ArrayList;
import java.util.List;

import com.noi.backend.services.extraction.util.AmountParser;
import com.noi.backend.services.extraction.util.FinancialKeywords;
import com.noi.backend.services.extraction.util.TextNormalizer;

/**
 * Splits a raw cell matrix into title lines, a header row and data rows.
 */
final class HeaderRowDetector {

    private static final int MAX_SCAN_ROWS = 10;

    private HeaderRowDetector() {
    }

    static TableBlock split(String name, List<List<String>> matrix) {
        List<List<String>> nonEmpty = new ArrayList<>();
        for (List<String> row : matrix) {
            if (!isBlankRow(row)) nonEmpty.add(row);
        }
        if (nonEmpty.isEmpty()) {
            return new TableBlock(name, List.of(), List.of(), List.of());
        }

        int headerIdx = -1;
        int limit = Math.min(nonEmpty.size(), MAX_SCAN_ROWS);
        for (int i = 0; i < limit; i++) {
            List<String> row = nonEmpty.get(i);
            if (hasNumericCell(row)) break;
            if (filledCells(row) >= 2 || FinancialKeywords.containsHeaderTerm(String.join(" ", row))) {
                headerIdx = i;
                break;
            }
        }

        List<String> titles = new ArrayList<>();
        List<String> headers = new ArrayList<>();
        int dataStart = 0;
        if (headerIdx >= 0) {
            for (int i = 0; i < headerIdx; i++) {
                titles.add(joinFilled(nonEmpty.get(i)));
            }
            for (String h : nonEmpty.get(headerIdx)) {
                headers.add(TextNormalizer.cleanCell(h));
            }
            dataStart = headerIdx + 1;
        }

        int width = 0;
        for (List<String> r : nonEmpty) width = Math.max(width, r.size());
        for (int c = 0; c < width; c++) {
            if (c >= headers.size()) headers.add("");
            if (headers.get(c).isEmpty()) headers.set(c, "Column" + (c + 1));
        }

        List<List<String>> rows = new ArrayList<>();
        for (int i = dataStart; i < nonEmpty.size(); i++) {
            List<String> cleaned = new ArrayList<>();
            for (String v : nonEmpty.get(i)) cleaned.add(TextNormalizer.cleanCell(v));
            rows.add(cleaned);
        }
        return new TableBlock(name, titles, headers, rows);
    }

    static boolean isBlankRow(List<String> row) {
        if (row == null) return true;
        for (String v : row) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }

    // Year-like integers in a header ("2023", "2024") are labels, not values.
    private static boolean hasNumericCell(List<String> row) {
        for (String v : row) {
            if (v == null || v.isBlank()) continue;
            if (!AmountParser.isAmount(v)) continue;
            List<AmountParser.AmountToken> tokens = AmountParser.findAll(v.trim());
            if (tokens.size() == 1 && tokens.get(0).isYearLike()) continue;
            return true;
        }
        return false;
    }

    private static int filledCells(List<String> row) {
        int n = 0;
        for (String v : row) {
            if (v != null && !v.isBlank()) n++;
        }
        return n;
    }

    private static String joinFilled(List<String> row) {
        List<String> parts = new ArrayList<>();
        for (String v : row) {
            if (v != null && !v.isBlank()) parts.add(TextNormalizer.cleanCell(v));
        }
        return String.join(" ", parts);
    }
}

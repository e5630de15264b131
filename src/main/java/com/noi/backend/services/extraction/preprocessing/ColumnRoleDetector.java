package com.noi.backend.services.extraction.preprocessing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ContentGateConfig;
import com.noi.backend.services.extraction.util.AmountParser;

import lombok.RequiredArgsConstructor;

/**
 * Decides which column holds labels and which holds values. Works on headers plus a cell matrix
 * only, with no knowledge of the file format the table came from.
 */
@Component
@RequiredArgsConstructor
public class ColumnRoleDetector {

    private static final Pattern PLACEHOLDER = Pattern.compile("(?i)^(unnamed:?\\s*\\d*|column\\s*\\d+|col\\s*\\d+|field\\s*\\d+|\\d+)?$");

    private static final Pattern IDENTIFIER = Pattern.compile("(?i)^(code|gl code|account|account #|account no\\.?|acct|acct #|id|#|no\\.?|year)$");

    private final ContentGateConfig config;

    public ColumnRoles detect(List<String> headers, List<List<String>> rows) {
        int width = headers.size();
        for (List<String> r : rows) width = Math.max(width, r.size());

        List<Double> ratios = new ArrayList<>(width);
        int[] textCells = new int[width];
        int[] filledCells = new int[width];
        for (int c = 0; c < width; c++) {
            int numeric = 0;
            for (List<String> r : rows) {
                String v = c < r.size() ? r.get(c) : null;
                if (v == null || v.isBlank()) continue;
                filledCells[c]++;
                if (AmountParser.isAmount(v)) {
                    numeric++;
                } else {
                    textCells[c]++;
                }
            }
            ratios.add(filledCells[c] == 0 ? 0.0 : (double) numeric / filledCells[c]);
        }

        int category = -1;
        for (int c = 0; c < width; c++) {
            if (textCells[c] > 0 && (category < 0 || textCells[c] > textCells[category])) {
                category = c;
            }
        }

        // Placeholder-named columns survive when they carry numbers, or when they hold the labels.
        List<Integer> kept = new ArrayList<>();
        for (int c = 0; c < width; c++) {
            if (c != category && isPlaceholder(headerAt(headers, c))
                    && ratios.get(c) < config.getPlaceholderColumnKeepRatio()) {
                continue;
            }
            kept.add(c);
        }

        if (kept.isEmpty()) {
            return new ColumnRoles(category, -1, kept, ratios, false);
        }

        int value = -1;
        for (int c : kept) {
            if (c > category && qualifies(c, headers, ratios)) {
                value = c;
                break;
            }
        }
        if (value < 0) {
            for (int c : kept) {
                if (c != category && qualifies(c, headers, ratios)) {
                    value = c;
                    break;
                }
            }
        }

        boolean defaulted = false;
        if (value < 0) {
            defaulted = true;
            for (int i = kept.size() - 1; i >= 0; i--) {
                if (kept.get(i) != category) {
                    value = kept.get(i);
                    break;
                }
            }
            if (value < 0) value = kept.get(kept.size() - 1);
        }

        return new ColumnRoles(category, value, kept, ratios, defaulted);
    }

    private boolean qualifies(int column, List<String> headers, List<Double> ratios) {
        if (ratios.get(column) <= config.getValueColumnRatio()) return false;
        return !IDENTIFIER.matcher(headerAt(headers, column).trim()).matches();
    }

    static boolean isPlaceholder(String header) {
        return header == null || PLACEHOLDER.matcher(header.trim().toLowerCase(Locale.ROOT)).matches();
    }

    private static String headerAt(List<String> headers, int c) {
        return c < headers.size() && headers.get(c) != null ? headers.get(c) : "";
    }
}

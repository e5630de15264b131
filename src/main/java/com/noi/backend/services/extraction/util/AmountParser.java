package com.noi.backend.services.extraction.util;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses monetary strings: currency symbols, thousands separators, decimals,
 * parenthesized negatives, leading or trailing minus.
 *
 * Example: "(1,234.56)" => -1234.56, "$ 30,000" => 30000, "1,500-" => -1500
 */
public final class AmountParser {

    private static final Pattern CELL_NUMBER = Pattern.compile("\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?|\\.\\d+");

    private static final Pattern CURRENCY = Pattern.compile("(?i)us\\$|usd|[$\u20AC\u00A3\u00A5]");

    // Amounts embedded in a line of text. Dates (12/31/2024) and percentages are not amounts.
    private static final Pattern EMBEDDED = Pattern.compile(
            "(?<![\\w.,/])"
                    + "(\\(\\s*)?"
                    + "([-\u2212])?"
                    + "((?:[Uu][Ss])?[$\u20AC\u00A3\u00A5]\\s*)?"
                    + "([-\u2212])?"
                    + "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)"
                    + "(\\s*\\))?"
                    + "(-(?!\\d))?"
                    + "(?![\\w%/])");

    private AmountParser() {
    }

    /**
     * Parses a whole cell. Returns null when the cell is not a single amount.
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String s = raw.replace('\u00A0', ' ').trim();
        if (s.isEmpty() || s.endsWith("%")) return null;

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1).trim();
        }
        if (s.startsWith("-") || s.startsWith("\u2212")) {
            negative = !negative;
            s = s.substring(1).trim();
        }
        s = CURRENCY.matcher(s).replaceAll("").trim();
        if (s.startsWith("-") || s.startsWith("\u2212")) {
            negative = !negative;
            s = s.substring(1).trim();
        }
        if (s.endsWith("-")) {
            negative = !negative;
            s = s.substring(0, s.length() - 1).trim();
        }
        s = s.replace(" ", "");
        if (!CELL_NUMBER.matcher(s).matches()) return null;

        try {
            BigDecimal value = new BigDecimal(s.replace(",", ""));
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isAmount(String raw) {
        return parse(raw) != null;
    }

    /**
     * Finds every amount in a line, left to right.
     */
    public static List<AmountToken> findAll(String line) {
        List<AmountToken> out = new ArrayList<>();
        if (line == null || line.isEmpty()) return out;

        Matcher m = EMBEDDED.matcher(line);
        while (m.find()) {
            boolean parenthesized = m.group(1) != null && m.group(6) != null;
            boolean minus = m.group(2) != null || m.group(4) != null || m.group(7) != null;
            String digits = m.group(5);
            BigDecimal value;
            try {
                value = new BigDecimal(digits.replace(",", ""));
            } catch (NumberFormatException e) {
                continue;
            }
            if (parenthesized ^ minus) {
                value = value.negate();
            }
            out.add(new AmountToken(
                    m.start(),
                    m.end(),
                    value,
                    digits.contains(","),
                    digits.contains("."),
                    m.group(3) != null));
        }
        return out;
    }

    /**
     * One amount found inside a line.
     *
     * @param grouped  written with thousands separators
     * @param decimal  written with a fractional part
     * @param currency written with a currency symbol
     */
    public record AmountToken(int start, int end, BigDecimal value, boolean grouped, boolean decimal, boolean currency) {

        /** Bare integers between 1900 and 2100: years in headers, not money. */
        public boolean isYearLike() {
            if (grouped || decimal || currency) return false;
            BigDecimal abs = value.abs();
            return abs.compareTo(BigDecimal.valueOf(1900)) >= 0 && abs.compareTo(BigDecimal.valueOf(2100)) <= 0;
        }

        public boolean exceeds(BigDecimal threshold) {
            return value.abs().compareTo(threshold) > 0;
        }
    }

    public static String format(BigDecimal value) {
        if (value == null) return "";
        return String.format(Locale.US, "%,.2f", value);
    }
}

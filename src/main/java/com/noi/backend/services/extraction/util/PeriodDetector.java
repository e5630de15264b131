package com.noi.backend.services.extraction.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reporting period from a filename: "noi_2024-03.xlsx", "03-2024 budget.csv", "rent roll 03-31-2024.pdf".
 * Returns "YYYY-MM" or null.
 */
public final class PeriodDetector {

    private static final Pattern MM_DD_YYYY = Pattern.compile("(?<!\\d)(0?[1-9]|1[0-2])[-_.](?:0?[1-9]|[12]\\d|3[01])[-_.]((?:19|20)\\d{2})(?!\\d)");
    private static final Pattern YYYY_MM = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})[-_.](0?[1-9]|1[0-2])(?!\\d)");
    private static final Pattern MM_YYYY = Pattern.compile("(?<!\\d)(0?[1-9]|1[0-2])[-_.]((?:19|20)\\d{2})(?!\\d)");

    private PeriodDetector() {
    }

    public static String fromFilename(String filename) {
        if (filename == null || filename.isBlank()) return null;

        Matcher m = MM_DD_YYYY.matcher(filename);
        if (m.find()) return format(m.group(2), m.group(1));

        m = YYYY_MM.matcher(filename);
        if (m.find()) return format(m.group(1), m.group(2));

        m = MM_YYYY.matcher(filename);
        if (m.find()) return format(m.group(2), m.group(1));

        return null;
    }

    private static String format(String year, String month) {
        return String.format("%s-%02d", year, Integer.parseInt(month));
    }
}

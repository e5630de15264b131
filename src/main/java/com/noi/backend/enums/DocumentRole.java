package com.noi.backend.enums;

import java.util.Locale;

/**
 * Period a document represents within an NOI comparison.
 */
public enum DocumentRole {
    CURRENT("current"),
    PRIOR("prior"),
    BUDGET("budget"),
    PRIOR_YEAR("prior_year");

    private final String key;

    DocumentRole(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Lenient parse: accepts "current_month_actuals", "prior month", "budgeted", "prior-year", etc.
     * Returns null when nothing matches.
     */
    public static DocumentRole fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');

        if (v.contains("budget") || v.contains("forecast") || v.contains("projected") || v.equals("plan")) {
            return BUDGET;
        }
        if ((v.contains("prior") || v.contains("previous") || v.contains("last")) && v.contains("year")) {
            return PRIOR_YEAR;
        }
        if (v.equals("yoy")) {
            return PRIOR_YEAR;
        }
        if (v.contains("prior") || v.contains("previous") || v.contains("last_month") || v.equals("mom")) {
            return PRIOR;
        }
        if (v.contains("current") || v.contains("actual")) {
            return CURRENT;
        }
        return null;
    }

    /**
     * Infers the role from a filename. Defaults to {@link #CURRENT}.
     */
    public static DocumentRole fromFilename(String filename) {
        if (filename == null) return CURRENT;
        String f = filename.toLowerCase(Locale.ROOT);
        if (f.contains("budget")) return BUDGET;
        if (f.contains("prior") || f.contains("previous")) {
            return f.contains("year") ? PRIOR_YEAR : PRIOR;
        }
        return CURRENT;
    }
}

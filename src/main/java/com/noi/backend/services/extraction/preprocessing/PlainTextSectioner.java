package com.noi.backend.services.extraction.preprocessing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.noi.backend.services.extraction.util.AmountParser;

/**
 * Marks section headers in free text so that statement blocks stand out without any table structure.
 */
@Component
public class PlainTextSectioner {

    private static final Map<String, String> SECTION_MARKERS = new LinkedHashMap<>();

    static {
        SECTION_MARKERS.put("REVENUE", "[REVENUE_SECTION]");
        SECTION_MARKERS.put("INCOME", "[INCOME_SECTION]");
        SECTION_MARKERS.put("EXPENSE", "[EXPENSE_SECTION]");
        SECTION_MARKERS.put("OPERATING", "[OPERATING_SECTION]");
        SECTION_MARKERS.put("PROPERTY", "[PROPERTY_INFORMATION]");
        SECTION_MARKERS.put("TOTAL", "[SUMMARY_SECTION]");
    }

    public String section(String text) {
        if (text == null || text.isBlank()) return "";
        StringBuilder sb = new StringBuilder();
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            String marker = markerFor(line);
            if (marker != null) {
                sb.append(marker).append('\n');
            }
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * A header line carries a keyword and no amount: "OPERATING EXPENSES", "Income:".
     */
    static String markerFor(String line) {
        if (!AmountParser.findAll(line).isEmpty()) return null;
        String upper = line.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> e : SECTION_MARKERS.entrySet()) {
            if (upper.contains(e.getKey())) return e.getValue();
        }
        return null;
    }
}

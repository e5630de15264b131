package com.noi.backend.services.extraction.preprocessing;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular-ish table as read from a sheet, CSV file or PDF page, before any role detection.
 *
 * @param titleLines text rows found above the header row (property name, report title)
 */
public record TableBlock(String name, List<String> titleLines, List<String> headers, List<List<String>> rows) {

    public TableBlock {
        titleLines = titleLines == null ? List.of() : List.copyOf(titleLines);
        headers = headers == null ? List.of() : List.copyOf(headers);
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> r : rows) {
                copy.add(r == null ? List.of() : List.copyOf(r));
            }
        }
        rows = List.copyOf(copy);
    }

    public int columnCount() {
        int n = headers.size();
        for (List<String> r : rows) {
            n = Math.max(n, r.size());
        }
        return n;
    }

    public String cell(int row, int col) {
        List<String> r = rows.get(row);
        if (col < 0 || col >= r.size()) return "";
        String v = r.get(col);
        return v == null ? "" : v;
    }

    public String header(int col) {
        if (col < 0 || col >= headers.size()) return "";
        String h = headers.get(col);
        return h == null ? "" : h;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

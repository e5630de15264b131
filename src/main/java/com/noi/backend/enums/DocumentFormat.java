package com.noi.backend.enums;

public enum DocumentFormat {
    PDF,
    XLSX,
    XLS,
    CSV,
    TXT,
    UNKNOWN;

    public boolean isSpreadsheet() {
        return this == XLSX || this == XLS;
    }

    public boolean isTabular() {
        return isSpreadsheet() || this == CSV;
    }
}

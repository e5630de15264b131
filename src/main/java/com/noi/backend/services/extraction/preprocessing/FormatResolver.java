package com.noi.backend.services.extraction.preprocessing;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.services.extraction.util.TextDecoder;

/**
 * Resolves the document format: explicit hint, then file extension, then magic bytes.
 * Unknown formats that decode as text are read as plain text.
 */
@Component
public class FormatResolver {

    public DocumentFormat resolve(byte[] bytes, String filename, String formatHint) {
        DocumentFormat fromHint = fromHint(formatHint);
        if (fromHint != DocumentFormat.UNKNOWN) return fromHint;

        DocumentFormat fromName = fromExtension(filename);
        if (fromName != DocumentFormat.UNKNOWN) return fromName;

        DocumentFormat fromMagic = fromMagicBytes(bytes);
        if (fromMagic != DocumentFormat.UNKNOWN) return fromMagic;

        if (bytes != null && bytes.length > 0 && !TextDecoder.looksBinary(bytes)) {
            return DocumentFormat.TXT;
        }
        return DocumentFormat.UNKNOWN;
    }

    /**
     * Accepts extensions ("xlsx", ".csv") and MIME types ("application/pdf", "text/csv").
     */
    static DocumentFormat fromHint(String hint) {
        if (hint == null || hint.isBlank()) return DocumentFormat.UNKNOWN;
        String h = hint.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith(".")) h = h.substring(1);

        if (h.equals("pdf") || h.contains("/pdf")) return DocumentFormat.PDF;
        if (h.equals("xlsx") || h.contains("openxmlformats-officedocument.spreadsheetml")) return DocumentFormat.XLSX;
        if (h.equals("xls") || h.contains("ms-excel")) return DocumentFormat.XLS;
        if (h.equals("csv") || h.equals("tsv") || h.contains("/csv") || h.contains("tab-separated")) return DocumentFormat.CSV;
        if (h.equals("txt") || h.equals("text") || h.equals("text/plain")) return DocumentFormat.TXT;
        return DocumentFormat.UNKNOWN;
    }

    public static DocumentFormat fromExtension(String filename) {
        if (filename == null) return DocumentFormat.UNKNOWN;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return DocumentFormat.UNKNOWN;
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        switch (ext) {
            case "pdf":
                return DocumentFormat.PDF;
            case "xlsx":
            case "xlsm":
                return DocumentFormat.XLSX;
            case "xls":
                return DocumentFormat.XLS;
            case "csv":
            case "tsv":
                return DocumentFormat.CSV;
            case "txt":
            case "text":
                return DocumentFormat.TXT;
            default:
                return DocumentFormat.UNKNOWN;
        }
    }

    static DocumentFormat fromMagicBytes(byte[] bytes) {
        if (bytes == null || bytes.length < 4) return DocumentFormat.UNKNOWN;
        if (bytes[0] == '%' && bytes[1] == 'P' && bytes[2] == 'D' && bytes[3] == 'F') return DocumentFormat.PDF;
        // ZIP container: the only ZIP format accepted here is OOXML.
        if (bytes[0] == 'P' && bytes[1] == 'K' && bytes[2] == 3 && bytes[3] == 4) return DocumentFormat.XLSX;
        if ((bytes[0] & 0xFF) == 0xD0 && (bytes[1] & 0xFF) == 0xCF && (bytes[2] & 0xFF) == 0x11 && (bytes[3] & 0xFF) == 0xE0) {
            return DocumentFormat.XLS;
        }
        return DocumentFormat.UNKNOWN;
    }
}

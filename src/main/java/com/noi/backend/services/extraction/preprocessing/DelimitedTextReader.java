package com.noi.backend.services.extraction.preprocessing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.noi.backend.services.extraction.UnsupportedFormatException;
import com.noi.backend.services.extraction.util.TextDecoder;

import lombok.extern.slf4j.Slf4j;

/**
 * CSV and other delimited exports. The delimiter is sniffed from the first lines.
 */
@Slf4j
@Component
public class DelimitedTextReader {

    private static final char[] CANDIDATES = {',', ';', '\t', '|'};
    private static final int SNIFF_LINES = 20;

    public TableBlock read(byte[] bytes, String name) {
        String text = TextDecoder.decode(bytes);
        if (text.isBlank()) {
            throw new UnsupportedFormatException("Delimited file is empty");
        }
        if (TextDecoder.looksBinary(bytes)) {
            throw new UnsupportedFormatException("File does not look like delimited text");
        }

        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("\uFEFF")) line = line.substring(1);
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UnsupportedFormatException("Could not read delimited text", e);
        }

        char delimiter = detectDelimiter(lines);
        log.debug("[Preprocessor] Delimiter for {}: '{}'", name, delimiter == '\t' ? "\\t" : String.valueOf(delimiter));

        List<List<String>> matrix = new ArrayList<>();
        for (String line : joinQuotedLineBreaks(lines)) {
            if (line.isBlank()) continue;
            matrix.add(splitLine(line, delimiter));
        }
        return HeaderRowDetector.split(name, matrix);
    }

    /**
     * Picks the candidate that splits the most lines into the same number of fields.
     * Falls back to comma.
     */
    static char detectDelimiter(List<String> lines) {
        char best = ',';
        int bestScore = 0;
        for (char candidate : CANDIDATES) {
            Map<Integer, Integer> countsByFields = new HashMap<>();
            int seen = 0;
            for (String line : lines) {
                if (line.isBlank()) continue;
                if (seen++ >= SNIFF_LINES) break;
                int n = countOutsideQuotes(line, candidate);
                if (n > 0) countsByFields.merge(n, 1, Integer::sum);
            }
            int score = 0;
            for (int v : countsByFields.values()) score = Math.max(score, v);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    static List<String> splitLine(String line, char delimiter) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (ch == delimiter && !quoted) {
                out.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        out.add(cur.toString().trim());
        return out;
    }

    private static int countOutsideQuotes(String line, char delimiter) {
        int n = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') quoted = !quoted;
            else if (ch == delimiter && !quoted) n++;
        }
        return n;
    }

    // A quoted field may span physical lines; glue them back before splitting.
    private static List<String> joinQuotedLineBreaks(List<String> lines) {
        List<String> out = new ArrayList<>();
        StringBuilder pending = null;
        for (String line : lines) {
            if (pending != null) {
                pending.append(' ').append(line);
                if (quoteCount(pending) % 2 == 0) {
                    out.add(pending.toString());
                    pending = null;
                }
                continue;
            }
            if (quoteCount(line) % 2 != 0) {
                pending = new StringBuilder(line);
            } else {
                out.add(line);
            }
        }
        if (pending != null) out.add(pending.toString());
        return out;
    }

    private static int quoteCount(CharSequence s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '"') n++;
        }
        return n;
    }
}

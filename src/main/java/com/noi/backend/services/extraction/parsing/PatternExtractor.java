package com.noi.backend.services.extraction.parsing;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.LineItem;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.parsing.FieldLabelMatcher.LabelMatch;
import com.noi.backend.services.extraction.util.AmountParser;
import com.noi.backend.services.extraction.util.AmountParser.AmountToken;
import com.noi.backend.services.extraction.util.TextNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic extraction: a known label followed by an amount. Needs no model.
 *
 * Detected (category, value) pairs are read first, then every body line. The first match per
 * field wins.
 */
@Slf4j
@Component
public class PatternExtractor {

    public ParsedRecord extract(PreprocessedContent content) {
        ParsedRecord parsed = ParsedRecord.empty();
        if (content == null || !content.isReadable()) return parsed;

        int fromItems = 0;
        for (LineItem item : content.getLineItems()) {
            LabelMatch match = FieldLabelMatcher.find(item.category());
            if (match == null || parsed.getRecord().has(match.field())) continue;
            parsed.put(match.field(), item.value(), FieldProvenance.PATTERN_FALLBACK);
            fromItems++;
        }

        int fromText = 0;
        for (String line : content.bodyOrEmpty().split("\\r?\\n")) {
            if (isMarkupLine(line)) continue;
            String normalized = TextNormalizer.normalizeLabel(line);
            LabelMatch match = FieldLabelMatcher.find(normalized);
            if (match == null || parsed.getRecord().has(match.field())) continue;

            BigDecimal value = firstAmountAfter(normalized, match.end());
            if (value == null) continue;
            parsed.put(match.field(), value, FieldProvenance.PATTERN_FALLBACK);
            fromText++;
        }

        log.info("[PatternExtractor] {} fields from line items, {} from text", fromItems, fromText);
        return parsed;
    }

    static BigDecimal firstAmountAfter(String line, int offset) {
        List<AmountToken> tokens = AmountParser.findAll(line);
        for (AmountToken token : tokens) {
            if (token.start() < offset || token.isYearLike()) continue;
            return token.value();
        }
        return null;
    }

    private static boolean isMarkupLine(String line) {
        String t = line.trim();
        return t.isEmpty()
                || t.startsWith("COLUMN HEADERS:")
                || t.startsWith("SECTION:")
                || (t.startsWith("[") && t.indexOf(']') > 0 && t.substring(t.indexOf(']') + 1).trim().matches("\\d*"));
    }
}

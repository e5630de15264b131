package com.noi.backend.services.extraction.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.enums.ConfidenceLevel;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.FinancialRecord;
import com.noi.backend.services.extraction.model.LineItem;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.parsing.FieldLabelMatcher;
import com.noi.backend.services.extraction.util.AmountParser;
import com.noi.backend.services.extraction.util.AmountParser.AmountToken;
import com.noi.backend.services.extraction.validation.ConsistencyValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Field scores by provenance:
 * <ul>
 * <li>model value on a source line carrying the field's label: 0.95; elsewhere in the source: 0.85</li>
 * <li>model value not found in the source but equal to its identity-derived value: scored as calculated</li>
 * <li>model value not found in the source otherwise (inferred): 0.40</li>
 * <li>pattern value from a detected line item: 0.65; from free text: 0.55</li>
 * <li>calculated: 0.6 + 0.2 x weakest input, within [0.6, 0.8]</li>
 * <li>missing: 0.0</li>
 * </ul>
 * The overall level follows the weakest primary metric.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    static final double MODEL_ON_LABELLED_LINE = 0.95;
    static final double MODEL_IN_SOURCE = 0.85;
    static final double MODEL_INFERRED = 0.40;
    static final double PATTERN_LINE_ITEM = 0.65;
    static final double PATTERN_TEXT = 0.55;
    static final double CALCULATED_FLOOR = 0.60;
    static final double CALCULATED_CEILING = 0.80;

    private final ConsistencyConfig consistencyConfig;

    public ConfidenceReport score(ParsedRecord parsed, PreprocessedContent content) {
        FinancialRecord record = parsed.getRecord();
        EnumMap<FinancialField, Double> scores = new EnumMap<>(FinancialField.class);
        EnumMap<FinancialField, FieldProvenance> provenance = new EnumMap<>(FinancialField.class);
        String[] lines = content == null ? new String[0] : content.bodyOrEmpty().split("\\r?\\n");
        List<LineItem> items = content == null ? List.of() : content.getLineItems();
        Set<FinancialField> derived = EnumSet.noneOf(FinancialField.class);

        for (FinancialField f : FinancialField.values()) {
            FieldProvenance p = parsed.provenanceOf(f);
            if (p == FieldProvenance.CALCULATED) continue;
            if (p == FieldProvenance.UNRESOLVED) {
                scores.put(f, 0.0);
                provenance.put(f, p);
                continue;
            }
            BigDecimal value = record.get(f);
            double s;
            if (p == FieldProvenance.MODEL_EXTRACTED && onLabelledLine(f, value, lines, items)) {
                s = MODEL_ON_LABELLED_LINE;
            } else if (p == FieldProvenance.MODEL_EXTRACTED && inSource(value, lines, items)) {
                s = MODEL_IN_SOURCE;
            } else if (isModel(p) && matchesIdentity(f, value, record)) {
                derived.add(f);
                continue;
            } else if (isModel(p)) {
                p = FieldProvenance.MODEL_INFERRED;
                s = MODEL_INFERRED;
            } else {
                s = inLineItems(f, value, items) ? PATTERN_LINE_ITEM : PATTERN_TEXT;
            }
            scores.put(f, s);
            provenance.put(f, p);
        }

        // Dependency order: totals from components, then EGI, then NOI.
        scoreCalculated(FinancialField.OPEX, FinancialField.opexComponents(), parsed, derived, scores, provenance);
        scoreCalculated(FinancialField.OTHER_INCOME, FinancialField.incomeComponents(), parsed, derived, scores, provenance);
        scoreCalculated(FinancialField.EGI, List.of(FinancialField.GPR, FinancialField.VACANCY_LOSS,
                FinancialField.CONCESSIONS, FinancialField.BAD_DEBT, FinancialField.OTHER_INCOME), parsed, derived,
                scores, provenance);
        scoreCalculated(FinancialField.NOI, List.of(FinancialField.EGI, FinancialField.OPEX), parsed, derived,
                scores, provenance);
        for (FinancialField f : FinancialField.values()) {
            if (!scores.containsKey(f)) {
                scores.put(f, CALCULATED_FLOOR);
                provenance.put(f, FieldProvenance.CALCULATED);
            }
        }

        double overall = 1.0;
        for (FinancialField f : FinancialField.PRIMARY_METRICS) {
            overall = Math.min(overall, scores.get(f));
        }
        ConfidenceLevel level = ConfidenceLevel.fromScore(overall);
        log.debug("[ConfidenceScorer] overall={} level={}", round(overall), level);
        return new ConfidenceReport(scores, provenance, round(overall), level);
    }

    private void scoreCalculated(FinancialField field, List<FinancialField> inputs, ParsedRecord parsed,
            Set<FinancialField> derived, EnumMap<FinancialField, Double> scores,
            EnumMap<FinancialField, FieldProvenance> provenance) {
        if (parsed.provenanceOf(field) != FieldProvenance.CALCULATED && !derived.contains(field)) return;
        double weakest = 1.0;
        boolean any = false;
        for (FinancialField in : inputs) {
            if (!parsed.getRecord().has(in)) continue;
            Double s = scores.get(in);
            if (s == null) continue;
            weakest = Math.min(weakest, s);
            any = true;
        }
        double s = any ? CALCULATED_FLOOR + 0.2 * weakest : CALCULATED_FLOOR;
        scores.put(field, round(Math.max(CALCULATED_FLOOR, Math.min(CALCULATED_CEILING, s))));
        provenance.put(field, FieldProvenance.CALCULATED);
    }

    private static boolean isModel(FieldProvenance p) {
        return p == FieldProvenance.MODEL_EXTRACTED || p == FieldProvenance.MODEL_INFERRED;
    }

    /**
     * A model total that the source does not show but the record's own inputs reproduce.
     */
    private boolean matchesIdentity(FinancialField field, BigDecimal value, FinancialRecord record) {
        BigDecimal expected = ConsistencyValidator.derive(record, field);
        return expected != null && value.subtract(expected).abs().compareTo(consistencyConfig.getTolerance()) <= 0;
    }

    private static boolean onLabelledLine(FinancialField field, BigDecimal value, String[] lines, List<LineItem> items) {
        if (inLineItems(field, value, items)) return true;
        for (String line : lines) {
            if (lineHasAmount(line, value) && FieldLabelMatcher.mentions(line, field)) return true;
        }
        return false;
    }

    private static boolean inSource(BigDecimal value, String[] lines, List<LineItem> items) {
        for (LineItem item : items) {
            if (sameMagnitude(item.value(), value)) return true;
        }
        for (String line : lines) {
            if (lineHasAmount(line, value)) return true;
        }
        return false;
    }

    private static boolean inLineItems(FinancialField field, BigDecimal value, List<LineItem> items) {
        for (LineItem item : items) {
            if (sameMagnitude(item.value(), value) && FieldLabelMatcher.mentions(item.category(), field)) return true;
        }
        return false;
    }

    private static boolean lineHasAmount(String line, BigDecimal value) {
        for (AmountToken token : AmountParser.findAll(line)) {
            if (sameMagnitude(token.value(), value)) return true;
        }
        return false;
    }

    private static boolean sameMagnitude(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return false;
        return a.abs().subtract(b.abs()).abs().compareTo(new BigDecimal("0.005")) < 0;
    }

    private static double round(double v) {
        return BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}

package com.noi.backend.services.extraction.validation;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.FinancialRecord;
import com.noi.backend.services.extraction.model.ParsedRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Enforces EGI = GPR - vacancy - concessions - bad debt + other income and NOI = EGI - OpEx.
 * Identity breaks are repaired in place; itemized-vs-total mismatches are only reported.
 *
 * A second pass over a record this validator already touched changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsistencyValidator {

    private final ConsistencyConfig config;

    public ConsistencyReport validate(ParsedRecord parsed) {
        ConsistencyReport report = new ConsistencyReport();
        FinancialRecord record = parsed.getRecord();
        BigDecimal tolerance = config.getTolerance();

        fillTotal(parsed, FinancialField.OPEX, FinancialField.opexComponents(), report);
        fillTotal(parsed, FinancialField.OTHER_INCOME, FinancialField.incomeComponents(), report);

        BigDecimal egi = derive(record, FinancialField.EGI);
        if (egi != null) {
            enforce(parsed, FinancialField.EGI, egi, tolerance, report);
        }

        BigDecimal noi = derive(record, FinancialField.NOI);
        if (noi != null) {
            enforce(parsed, FinancialField.NOI, noi, tolerance, report);
        }

        checkComponents(record, FinancialField.OPEX, FinancialField.opexComponents(), tolerance, report);
        checkComponents(record, FinancialField.OTHER_INCOME, FinancialField.incomeComponents(), tolerance, report);
        return report;
    }

    /**
     * Value the identities give for a derivable field (OpEx and Other Income from their components,
     * EGI, NOI), or null when the field is not derivable or its inputs are missing.
     */
    public static BigDecimal derive(FinancialRecord record, FinancialField field) {
        switch (field) {
            case OPEX:
                return sum(record, FinancialField.opexComponents());
            case OTHER_INCOME:
                return sum(record, FinancialField.incomeComponents());
            case EGI:
                if (!record.has(FinancialField.GPR)) return null;
                return record.get(FinancialField.GPR)
                        .subtract(record.getOrZero(FinancialField.VACANCY_LOSS))
                        .subtract(record.getOrZero(FinancialField.CONCESSIONS))
                        .subtract(record.getOrZero(FinancialField.BAD_DEBT))
                        .add(record.getOrZero(FinancialField.OTHER_INCOME));
            case NOI:
                if (!record.has(FinancialField.EGI) || !record.has(FinancialField.OPEX)) return null;
                return record.get(FinancialField.EGI).subtract(record.get(FinancialField.OPEX));
            default:
                return null;
        }
    }

    private void fillTotal(ParsedRecord parsed, FinancialField total, List<FinancialField> components, ConsistencyReport report) {
        FinancialRecord record = parsed.getRecord();
        if (record.has(total)) return;
        BigDecimal sum = sum(record, components);
        if (sum == null) return;

        parsed.put(total, sum, FieldProvenance.CALCULATED);
        String detail = String.format("%s filled from components: %s", total.getKey(), sum.toPlainString());
        log.info("[Consistency] {}", detail);
        report.repaired(detail);
    }

    private void enforce(ParsedRecord parsed, FinancialField field, BigDecimal calculated, BigDecimal tolerance,
            ConsistencyReport report) {
        BigDecimal reported = parsed.getRecord().get(field);
        if (reported != null && reported.subtract(calculated).abs().compareTo(tolerance) <= 0) {
            return;
        }

        parsed.put(field, calculated, FieldProvenance.CALCULATED);
        String detail = reported == null
                ? String.format("%s calculated: %s", field.getKey(), calculated.toPlainString())
                : String.format("%s corrected: reported=%s calculated=%s", field.getKey(), reported.toPlainString(),
                        calculated.toPlainString());
        log.info("[Consistency] {}", detail);
        report.repaired(detail);
    }

    private void checkComponents(FinancialRecord record, FinancialField total, List<FinancialField> components,
            BigDecimal tolerance, ConsistencyReport report) {
        BigDecimal stated = record.get(total);
        BigDecimal sum = sum(record, components);
        if (stated == null || sum == null) return;

        BigDecimal diff = stated.subtract(sum).abs();
        if (diff.compareTo(tolerance) > 0) {
            String detail = String.format("%s components sum to %s but total is %s (difference %s)",
                    total.getKey(), sum.toPlainString(), stated.toPlainString(), diff.toPlainString());
            log.warn("[Consistency] {}", detail);
            report.warn(detail);
        }
    }

    /** Null when no component is present. */
    private static BigDecimal sum(FinancialRecord record, List<FinancialField> fields) {
        BigDecimal total = null;
        for (FinancialField f : fields) {
            BigDecimal v = record.get(f);
            if (v == null) continue;
            total = total == null ? v : total.add(v);
        }
        return total;
    }
}

package com.noi.backend.services.extraction.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.FinancialRecord;
import com.noi.backend.services.extraction.model.ParsedRecord;

class ConsistencyValidatorTest {

    private final ConsistencyValidator validator = new ConsistencyValidator(new ConsistencyConfig());

    private static ParsedRecord record(Object... fieldsAndValues) {
        ParsedRecord parsed = ParsedRecord.empty();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            parsed.put((FinancialField) fieldsAndValues[i], new BigDecimal((String) fieldsAndValues[i + 1]),
                    FieldProvenance.MODEL_EXTRACTED);
        }
        return parsed;
    }

    @Test
    void validate_calculatesMissingEgiAndNoi() {
        ParsedRecord parsed = record(
                FinancialField.GPR, "100000",
                FinancialField.VACANCY_LOSS, "-5000",
                FinancialField.OTHER_INCOME, "2000",
                FinancialField.OPEX, "40000");

        ConsistencyReport report = validator.validate(parsed);

        assertEquals(new BigDecimal("97000.00"), parsed.getRecord().get(FinancialField.EGI));
        assertEquals(new BigDecimal("57000.00"), parsed.getRecord().get(FinancialField.NOI));
        assertEquals(FieldProvenance.CALCULATED, parsed.provenanceOf(FinancialField.EGI));
        assertEquals(FieldProvenance.CALCULATED, parsed.provenanceOf(FinancialField.NOI));
        assertEquals(2, report.getRepairs().size());
    }

    @Test
    void validate_correctsNoiOutsideTolerance() {
        ParsedRecord parsed = record(
                FinancialField.EGI, "97000",
                FinancialField.OPEX, "40000",
                FinancialField.NOI, "60000");

        validator.validate(parsed);

        assertEquals(new BigDecimal("57000.00"), parsed.getRecord().get(FinancialField.NOI));
        assertEquals(FieldProvenance.CALCULATED, parsed.provenanceOf(FinancialField.NOI));
    }

    @Test
    void validate_keepsReportedValueWithinTolerance() {
        ParsedRecord parsed = record(
                FinancialField.EGI, "97000",
                FinancialField.OPEX, "40000",
                FinancialField.NOI, "57000.50");

        ConsistencyReport report = validator.validate(parsed);

        assertEquals(new BigDecimal("57000.50"), parsed.getRecord().get(FinancialField.NOI));
        assertEquals(FieldProvenance.MODEL_EXTRACTED, parsed.provenanceOf(FinancialField.NOI));
        assertFalse(report.changedRecord());
    }

    @Test
    void validate_fillsOpexFromComponents() {
        ParsedRecord parsed = record(
                FinancialField.PROPERTY_TAXES, "10000",
                FinancialField.INSURANCE, "2000");

        validator.validate(parsed);

        assertEquals(new BigDecimal("12000.00"), parsed.getRecord().get(FinancialField.OPEX));
        assertEquals(FieldProvenance.CALCULATED, parsed.provenanceOf(FinancialField.OPEX));
        assertNull(parsed.getRecord().get(FinancialField.NOI));
    }

    @Test
    void validate_onlyWarnsWhenComponentsDisagreeWithTotal() {
        ParsedRecord parsed = record(
                FinancialField.OPEX, "15000",
                FinancialField.PROPERTY_TAXES, "10000",
                FinancialField.INSURANCE, "2000");

        ConsistencyReport report = validator.validate(parsed);

        assertEquals(new BigDecimal("15000.00"), parsed.getRecord().get(FinancialField.OPEX));
        assertEquals(1, report.getWarnings().size());
        assertTrue(report.getWarnings().get(0).startsWith("opex components sum to 12000.00"));
    }

    @Test
    void validate_leavesEgiAloneWithoutGpr() {
        ParsedRecord parsed = record(
                FinancialField.VACANCY_LOSS, "5000",
                FinancialField.EGI, "90000");

        validator.validate(parsed);

        assertEquals(new BigDecimal("90000.00"), parsed.getRecord().get(FinancialField.EGI));
    }

    @Test
    void validate_secondPassChangesNothing() {
        ParsedRecord parsed = record(
                FinancialField.GPR, "100000",
                FinancialField.VACANCY_LOSS, "5000",
                FinancialField.PARKING, "1200",
                FinancialField.EGI, "80000",
                FinancialField.PROPERTY_TAXES, "10000",
                FinancialField.NOI, "1");

        assertTrue(validator.validate(parsed).changedRecord());
        FinancialRecord afterFirst = parsed.getRecord().copy();

        ConsistencyReport second = validator.validate(parsed);

        assertFalse(second.changedRecord());
        assertEquals(afterFirst, parsed.getRecord());
    }
}

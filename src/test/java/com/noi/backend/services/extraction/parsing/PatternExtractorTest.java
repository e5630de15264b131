package com.noi.backend.services.extraction.parsing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.ExtractionFixtures;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.model.RawDocument;
import com.noi.backend.services.extraction.validation.ConsistencyValidator;

class PatternExtractorTest {

    private final PatternExtractor extractor = new PatternExtractor();

    @Test
    void extract_readsDetectedLineItems() {
        PreprocessedContent content = ExtractionFixtures.preprocessor().preprocess(
                new RawDocument(ExtractionFixtures.utf8(ExtractionFixtures.SCENARIO_A_CSV), "a.csv", null));

        ParsedRecord parsed = extractor.extract(content);

        assertEquals(new BigDecimal("30000.00"), parsed.getRecord().get(FinancialField.GPR));
        assertEquals(new BigDecimal("16000.00"), parsed.getRecord().get(FinancialField.OPEX));
        assertEquals(FieldProvenance.PATTERN_FALLBACK, parsed.provenanceOf(FinancialField.GPR));
        assertEquals(2, parsed.getRecord().populatedCount());
    }

    @Test
    void extract_readsLabelledAmountsInFreeText() {
        PreprocessedContent content = PreprocessedContent.builder()
                .format(DocumentFormat.TXT)
                .filename("notes.txt")
                .header("TXT DOCUMENT: notes.txt")
                .body("Gross Potential Rent for 2024 was 120,000\n"
                        + "Net Operating Income 74,000.00\n"
                        + "Vacancy (5,000)\n"
                        + "Gross Potential Rent restated 999,999\n")
                .build();

        ParsedRecord parsed = extractor.extract(content);

        assertEquals(new BigDecimal("120000.00"), parsed.getRecord().get(FinancialField.GPR));
        assertEquals(new BigDecimal("74000.00"), parsed.getRecord().get(FinancialField.NOI));
        assertEquals(new BigDecimal("5000.00"), parsed.getRecord().get(FinancialField.VACANCY_LOSS));
        assertNull(parsed.getRecord().get(FinancialField.EGI));
    }

    @Test
    void extract_unreadableContentGivesEmptyRecord() {
        assertTrue(extractor.extract(PreprocessedContent.unreadable(DocumentFormat.PDF, "x.pdf", "scan")).isEmpty());
    }

    @Test
    void extract_reproducesRenderedStatement() {
        Map<FinancialField, BigDecimal> expected = new LinkedHashMap<>();
        expected.put(FinancialField.GPR, new BigDecimal("120000.00"));
        expected.put(FinancialField.VACANCY_LOSS, new BigDecimal("6000.00"));
        expected.put(FinancialField.CONCESSIONS, new BigDecimal("1500.00"));
        expected.put(FinancialField.BAD_DEBT, new BigDecimal("500.00"));
        expected.put(FinancialField.OTHER_INCOME, new BigDecimal("3000.00"));
        expected.put(FinancialField.EGI, new BigDecimal("115000.00"));
        expected.put(FinancialField.PROPERTY_TAXES, new BigDecimal("30000.00"));
        expected.put(FinancialField.INSURANCE, new BigDecimal("15000.00"));
        expected.put(FinancialField.OPEX, new BigDecimal("45000.00"));
        expected.put(FinancialField.NOI, new BigDecimal("70000.00"));

        StringBuilder csv = new StringBuilder("Category,Amount\n");
        expected.forEach((field, value) -> {
            String amount = field == FinancialField.VACANCY_LOSS ? "(" + value.toPlainString() + ")" : value.toPlainString();
            csv.append(field.getLabel()).append(',').append(amount).append('\n');
        });
        PreprocessedContent content = ExtractionFixtures.preprocessor().preprocess(
                new RawDocument(ExtractionFixtures.utf8(csv.toString()), "statement.csv", null));

        ParsedRecord parsed = extractor.extract(content);

        expected.forEach((field, value) -> assertEquals(value, parsed.getRecord().get(field), field.getKey()));
        assertEquals(expected.size(), parsed.getRecord().populatedCount());
        assertFalse(new ConsistencyValidator(new ConsistencyConfig()).validate(parsed).changedRecord());
    }
}

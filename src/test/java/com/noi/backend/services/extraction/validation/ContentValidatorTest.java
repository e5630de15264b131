package com.noi.backend.services.extraction.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.noi.backend.config.ContentGateConfig;
import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.services.extraction.model.PreprocessedContent;

class ContentValidatorTest {

    private final ContentValidator validator = new ContentValidator(new ContentGateConfig());

    private static PreprocessedContent content(String header, String body) {
        return PreprocessedContent.builder()
                .format(DocumentFormat.CSV)
                .filename("doc.csv")
                .header(header)
                .body(body)
                .build();
    }

    @Test
    void validate_acceptsSingleLabelledMaterialValue() {
        ContentValidation result = validator.validate(content("CSV DOCUMENT: doc.csv",
                "[FINANCIAL_STATEMENT_FORMAT]\nLINE ITEMS:\n  Rental Income: 30000.00\n"));

        assertTrue(result.hasFinancialContent());
        assertEquals(1, result.materialValues());
        assertEquals(1, result.keywordAdjacentValues());
    }

    @Test
    void validate_acceptsThreeUnlabelledMaterialValues() {
        ContentValidation result = validator.validate(content("", "Item A 5,000\nItem B 6,000\nItem C 7,000\n"));

        assertTrue(result.hasFinancialContent());
        assertEquals(3, result.materialValues());
        assertEquals(0, result.keywordAdjacentValues());
    }

    @Test
    void validate_rejectsTemplateWithLabelsOnly() {
        ContentValidation result = validator.validate(content("CSV DOCUMENT: template.csv",
                "[FINANCIAL_STATEMENT_FORMAT]\nLINE ITEMS:\n  SECTION: Gross Potential Rent\n  SECTION: Operating Expenses\n"));

        assertFalse(result.hasFinancialContent());
        assertEquals(0, result.materialValues());
    }

    @Test
    void validate_ignoresBannerYearsAndSmallNumbers() {
        ContentValidation result = validator.validate(content("CSV DOCUMENT: noi_987654.csv",
                "Year 2023 2024 2025\nUnits: 12\nRent per unit: 95\n"));

        assertFalse(result.hasFinancialContent());
        assertEquals(0, result.materialValues());
    }

    @Test
    void validate_thresholdsComeFromConfig() {
        ContentGateConfig config = new ContentGateConfig();
        config.setMinKeywordAdjacentValues(0);
        config.setMinMaterialValues(2);
        ContentValidator strict = new ContentValidator(config);

        assertFalse(strict.validate(content("", "Rental Income: 30000.00\n")).hasFinancialContent());
        assertTrue(strict.validate(content("", "Rental Income: 30000.00\nInsurance: 2400\n")).hasFinancialContent());
    }

    @Test
    void validate_rejectsUnreadableContent() {
        ContentValidation result = validator.validate(
                PreprocessedContent.unreadable(DocumentFormat.PDF, "scan.pdf", "PDF has no text layer"));

        assertFalse(result.hasFinancialContent());
        assertEquals("PDF has no text layer", result.reason());
    }
}

package com.noi.backend.services.extraction.preprocessing;

import static com.noi.backend.services.extraction.ExtractionFixtures.pdf;
import static com.noi.backend.services.extraction.ExtractionFixtures.utf8;
import static com.noi.backend.services.extraction.ExtractionFixtures.workbook;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.services.extraction.ExtractionFixtures;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.model.RawDocument;

class DocumentPreprocessorTest {

    private final DocumentPreprocessor preprocessor = ExtractionFixtures.preprocessor();

    @Test
    void preprocess_csvStatementKeepsBannerOutOfBody() {
        PreprocessedContent content = preprocessor.preprocess(
                new RawDocument(utf8(ExtractionFixtures.SCENARIO_A_CSV), "scenario_a.csv", null));

        assertTrue(content.isReadable());
        assertEquals(DocumentFormat.CSV, content.getFormat());
        assertTrue(content.getHeader().startsWith("CSV DOCUMENT: scenario_a.csv\n"));
        assertFalse(content.getBody().contains("scenario_a.csv"));
        assertTrue(content.isFinancialStatementFormat());
        assertTrue(content.getBody().contains("  Rental Income – Commercial: 30000.00\n"));
        assertEquals(2, content.getLineItems().size());
        assertTrue(content.promptText().endsWith(PreprocessedContent.DOCUMENT_END));
    }

    @Test
    void preprocess_spreadsheetWrapsEachSheet() {
        byte[] bytes = workbook("T12",
                new String[] {"Gross Potential Rent", "Insurance"},
                new Double[] {120000.0, 2400.0});

        PreprocessedContent content = preprocessor.preprocess(new RawDocument(bytes, "t12.xlsx", null));

        assertEquals(DocumentFormat.XLSX, content.getFormat());
        assertTrue(content.getBody().startsWith("[SHEET_START] T12\n"));
        assertTrue(content.getBody().contains("  Gross Potential Rent: 120000\n"));
        assertTrue(content.getBody().endsWith("[SHEET_END]\n"));
        assertTrue(content.getStructureIndicators().contains("sheets=1"));
    }

    @Test
    void preprocess_pdfRendersPageMarkup() {
        byte[] bytes = pdf("Gross Potential Rent 120,000.00", "Net Operating Income 74,000.00");

        PreprocessedContent content = preprocessor.preprocess(new RawDocument(bytes, "statement.pdf", null));

        assertTrue(content.isReadable());
        assertEquals(DocumentFormat.PDF, content.getFormat());
        assertTrue(content.getBody().startsWith("[PAGE_START] 1\n[TEXT_CONTENT]\n"));
        assertTrue(content.getBody().contains("Gross Potential Rent 120,000.00"));
        assertTrue(content.getBody().contains("[PAGE_END]"));
    }

    @Test
    void preprocess_pdfWithoutTextIsUnreadable() {
        PreprocessedContent content = preprocessor.preprocess(new RawDocument(pdf(), "scan.pdf", null));

        assertFalse(content.isReadable());
        assertEquals(DocumentFormat.PDF, content.getFormat());
        assertTrue(content.getFailureReason().contains("no text layer"));
    }

    @Test
    void preprocess_plainTextGetsSectionMarkers() {
        PreprocessedContent content = preprocessor.preprocess(new RawDocument(
                utf8("OPERATING EXPENSES\nInsurance 2,400\n"), "notes.txt", null));

        assertEquals(DocumentFormat.TXT, content.getFormat());
        assertEquals("[EXPENSE_SECTION]\nOPERATING EXPENSES\nInsurance 2,400\n", content.getBody());
    }

    @Test
    void preprocess_emptyAndUnknownInputAreUnreadable() {
        assertFalse(preprocessor.preprocess(new RawDocument(new byte[0], "empty.csv", null)).isReadable());

        PreprocessedContent binary = preprocessor.preprocess(new RawDocument(new byte[] {0, 1, 2, 3, 0}, "blob.bin", null));
        assertFalse(binary.isReadable());
        assertEquals(DocumentFormat.UNKNOWN, binary.getFormat());
    }

    @Test
    void preprocess_corruptWorkbookIsUnreadableNotAnError() {
        PreprocessedContent content = preprocessor.preprocess(new RawDocument(utf8("hello"), "broken.xlsx", null));

        assertFalse(content.isReadable());
        assertEquals(DocumentFormat.XLSX, content.getFormat());
        assertEquals("", content.bodyOrEmpty());
    }
}

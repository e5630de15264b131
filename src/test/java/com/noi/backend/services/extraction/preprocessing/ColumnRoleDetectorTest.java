package com.noi.backend.services.extraction.preprocessing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.noi.backend.config.ContentGateConfig;

class ColumnRoleDetectorTest {

    private final ColumnRoleDetector detector = new ColumnRoleDetector(new ContentGateConfig());

    @Test
    void detect_findsValueColumnAfterIdentifierAndPlaceholderColumns() {
        List<String> headers = List.of("GL Code", "Line Item", "Unnamed: 2", "Actual");
        List<List<String>> rows = List.of(
                List.of("4000", "Gross Potential Rent", "", "120,000.00"),
                List.of("4100", "Vacancy Loss", "", "(6,000.00)"),
                List.of("6000", "Property Taxes", "", "12,500.00"));

        ColumnRoles roles = detector.detect(headers, rows);

        assertEquals(1, roles.categoryColumn());
        assertEquals(3, roles.valueColumn());
        assertFalse(roles.keptColumns().contains(2));
        assertFalse(roles.valueColumnDefaulted());
        assertTrue(roles.hasPairs());
    }

    @Test
    void detect_keepsPlaceholderColumnThatCarriesNumbers() {
        List<String> headers = List.of("Item", "Unnamed: 1");
        List<List<String>> rows = List.of(
                List.of("Rental Income", "30000"),
                List.of("Insurance", "2400"));

        ColumnRoles roles = detector.detect(headers, rows);

        assertTrue(roles.keptColumns().contains(1));
        assertEquals(0, roles.categoryColumn());
        assertEquals(1, roles.valueColumn());
    }

    @Test
    void detect_defaultsToLastColumnWhenNothingIsNumeric() {
        List<String> headers = List.of("Category", "Amount");
        List<List<String>> rows = List.of(
                List.of("Gross Potential Rent", ""),
                List.of("Operating Expenses", ""));

        ColumnRoles roles = detector.detect(headers, rows);

        assertEquals(0, roles.categoryColumn());
        assertEquals(1, roles.valueColumn());
        assertTrue(roles.valueColumnDefaulted());
    }

    @Test
    void detect_countsNumericColumnsOfWideTables() {
        List<String> headers = List.of("Category", "Budget", "Actual", "Variance");
        List<List<String>> rows = List.of(
                List.of("Rental Income", "31000", "30000", "-1000"),
                List.of("Utilities", "1200", "1350", "150"));

        ColumnRoles roles = detector.detect(headers, rows);

        assertEquals(1, roles.valueColumn());
        assertEquals(3, roles.numericColumnCount(0.5));
    }

    @Test
    void isPlaceholder_recognizesGeneratedNames() {
        assertTrue(ColumnRoleDetector.isPlaceholder("Unnamed: 3"));
        assertTrue(ColumnRoleDetector.isPlaceholder("Column7"));
        assertTrue(ColumnRoleDetector.isPlaceholder(""));
        assertFalse(ColumnRoleDetector.isPlaceholder("Amount"));
    }
}

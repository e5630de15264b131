package com.noi.backend.services.extraction.preprocessing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.noi.backend.services.extraction.UnsupportedFormatException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads every sheet of an .xlsx or .xls workbook into a {@link TableBlock}.
 * Formula cells contribute their cached result, never the formula text.
 */
@Slf4j
@Component
public class SpreadsheetReader {

    private final DataFormatter formatter = new DataFormatter();

    public List<TableBlock> read(byte[] bytes) {
        List<TableBlock> tables = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            for (int s = 0; s < workbook.getNumberOfSheets(); s++) {
                Sheet sheet = workbook.getSheetAt(s);
                List<List<String>> matrix = readSheet(sheet);
                TableBlock table = HeaderRowDetector.split(sheet.getSheetName(), matrix);
                log.debug("[Preprocessor] Sheet '{}' rows={} columns={}", sheet.getSheetName(), table.rows().size(), table.columnCount());
                tables.add(table);
            }
        } catch (EncryptedDocumentException e) {
            throw new UnsupportedFormatException("Workbook is password protected", e);
        } catch (IOException | RuntimeException e) {
            throw new UnsupportedFormatException("Could not open workbook: " + e.getMessage(), e);
        }
        return tables;
    }

    private List<List<String>> readSheet(Sheet sheet) {
        List<List<String>> matrix = new ArrayList<>();
        for (Row row : sheet) {
            // Keep row positions so blank spacer rows do not shift data.
            while (matrix.size() < row.getRowNum()) {
                matrix.add(new ArrayList<>());
            }
            List<String> cells = new ArrayList<>();
            short last = row.getLastCellNum();
            for (int c = 0; c < last; c++) {
                cells.add(cellText(row.getCell(c)));
            }
            matrix.add(cells);
        }
        return matrix;
    }

    String cellText(Cell cell) {
        if (cell == null) return "";
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return formatter.formatCellValue(cell);
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case STRING:
                return cell.getStringCellValue() == null ? "" : cell.getStringCellValue().trim();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case ERROR:
            case BLANK:
            default:
                return "";
        }
    }
}

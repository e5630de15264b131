package com.noi.backend.services.extraction.preprocessing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import com.noi.backend.services.extraction.UnsupportedFormatException;

import lombok.extern.slf4j.Slf4j;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

/**
 * Page-ordered text and ruled tables from a text-based PDF. Scanned pages come back with
 * empty text; no OCR is attempted.
 */
@Slf4j
@Component
public class PdfContentExtractor {

    public List<PdfPage> extract(byte[] pdfBytes) {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            int pageCount = document.getNumberOfPages();
            List<PdfPage> pages = new ArrayList<>(pageCount);

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            ObjectExtractor extractor = new ObjectExtractor(document);
            SpreadsheetExtractionAlgorithm sea = new SpreadsheetExtractionAlgorithm();

            for (int p = 1; p <= pageCount; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                String text = stripper.getText(document);
                pages.add(new PdfPage(p, text == null ? "" : text.trim(), extractTables(extractor, sea, p)));
            }
            return pages;
        } catch (InvalidPasswordException e) {
            throw new UnsupportedFormatException("PDF is password protected", e);
        } catch (IOException e) {
            throw new UnsupportedFormatException("Could not read PDF: " + e.getMessage(), e);
        }
    }

    private List<List<List<String>>> extractTables(ObjectExtractor extractor, SpreadsheetExtractionAlgorithm sea, int pageNumber) {
        List<List<List<String>>> out = new ArrayList<>();
        try {
            Page page = extractor.extract(pageNumber);
            for (Table table : sea.extract(page)) {
                List<List<String>> rows = new ArrayList<>();
                for (List<RectangularTextContainer> row : table.getRows()) {
                    List<String> cells = new ArrayList<>(row.size());
                    for (RectangularTextContainer cell : row) {
                        cells.add(cell.getText() == null ? "" : cell.getText().replace('\r', ' ').trim());
                    }
                    rows.add(cells);
                }
                if (!rows.isEmpty()) out.add(rows);
            }
        } catch (RuntimeException e) {
            // Table detection is best effort; the page text is still kept.
            log.warn("[Preprocessor] Table detection failed on page {}: {}", pageNumber, e.toString());
        }
        return out;
    }

    public record PdfPage(int number, String text, List<List<List<String>>> tables) {
    }
}

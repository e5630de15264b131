package com.noi.backend.services.extraction;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.config.ContentGateConfig;
import com.noi.backend.config.ModelExtractionProperties;
import com.noi.backend.services.extraction.engine.ExtractionEngine;
import com.noi.backend.services.extraction.engine.ExtractionRateLimiter;
import com.noi.backend.services.extraction.engine.ModelClient;
import com.noi.backend.services.extraction.parsing.PatternExtractor;
import com.noi.backend.services.extraction.parsing.ResponseParser;
import com.noi.backend.services.extraction.preprocessing.ColumnRoleDetector;
import com.noi.backend.services.extraction.preprocessing.DelimitedTextReader;
import com.noi.backend.services.extraction.preprocessing.DocumentPreprocessor;
import com.noi.backend.services.extraction.preprocessing.FormatResolver;
import com.noi.backend.services.extraction.preprocessing.PdfContentExtractor;
import com.noi.backend.services.extraction.preprocessing.PlainTextSectioner;
import com.noi.backend.services.extraction.preprocessing.SpreadsheetReader;
import com.noi.backend.services.extraction.preprocessing.TabularContentFormatter;
import com.noi.backend.services.extraction.prompt.PromptBuilder;
import com.noi.backend.services.extraction.scoring.ConfidenceScorer;
import com.noi.backend.services.extraction.validation.ConsistencyValidator;
import com.noi.backend.services.extraction.validation.ContentValidator;

/**
 * Real components wired by hand, plus small document builders for tests.
 */
public final class ExtractionFixtures {

    public static final String SCENARIO_A_CSV =
            "Category,Amount\n"
                    + "Rental Income – Commercial,30000.00\n"
                    + "Total Operating Expenses,16000.00\n";

    private ExtractionFixtures() {
    }

    public static DocumentPreprocessor preprocessor() {
        ContentGateConfig config = new ContentGateConfig();
        return new DocumentPreprocessor(
                new FormatResolver(),
                new SpreadsheetReader(),
                new DelimitedTextReader(),
                new PdfContentExtractor(),
                new PlainTextSectioner(),
                new TabularContentFormatter(new ColumnRoleDetector(config), config));
    }

    public static ModelExtractionProperties fastModelProperties() {
        ModelExtractionProperties properties = new ModelExtractionProperties();
        properties.setBaseDelayMs(10);
        properties.setMaxDelayMs(40);
        properties.setRequestsPerMinute(0);
        properties.setCallTimeoutSeconds(5);
        return properties;
    }

    /**
     * Engine with a same-thread executor and a no-op sleeper.
     */
    public static ExtractionEngine engine(ModelClient client, ModelExtractionProperties properties) {
        return new ExtractionEngine(
                client,
                new PromptBuilder(properties),
                new ResponseParser(),
                properties,
                new ExtractionRateLimiter(properties),
                Runnable::run,
                millis -> { });
    }

    public static FinancialExtractionPipeline pipeline(ModelClient client) {
        return pipeline(engine(client, fastModelProperties()));
    }

    public static FinancialExtractionPipeline pipeline(ExtractionEngine engine) {
        return new FinancialExtractionPipeline(
                preprocessor(),
                new ContentValidator(new ContentGateConfig()),
                engine,
                new PatternExtractor(),
                new ConsistencyValidator(new ConsistencyConfig()),
                new ConfidenceScorer(new ConsistencyConfig()));
    }

    public static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Single-sheet workbook; a null value leaves the value cell out.
     */
    public static byte[] workbook(String sheetName, String[] labels, Double[] values) {
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet(sheetName);
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Category");
            header.createCell(1).setCellValue("Amount");
            for (int i = 0; i < labels.length; i++) {
                Row row = sheet.createRow(i + 1);
                row.createCell(0).setCellValue(labels[i]);
                if (values[i] != null) {
                    row.createCell(1).setCellValue(values[i]);
                }
            }
            wb.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * One page; each string is drawn on its own line. No lines gives a page without text.
     */
    public static byte[] pdf(String... lines) {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            if (lines.length > 0) {
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(50, 700);
                    for (String line : lines) {
                        cs.showText(line);
                        cs.newLineAtOffset(0, -20);
                    }
                    cs.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.noi.backend.services.extraction.preprocessing;

import java.util.List;

import org.springframework.stereotype.Service;

import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.services.extraction.UnsupportedFormatException;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.model.RawDocument;
import com.noi.backend.services.extraction.preprocessing.PdfContentExtractor.PdfPage;
import com.noi.backend.services.extraction.preprocessing.TabularContentFormatter.FormattedTable;
import com.noi.backend.services.extraction.util.FinancialKeywords;
import com.noi.backend.services.extraction.util.TextDecoder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw bytes into {@link PreprocessedContent}. Unreadable input never throws: it yields an
 * empty content object carrying the failure reason.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentPreprocessor {

    static final String BANNER_RULE = "=".repeat(60);

    private final FormatResolver formatResolver;
    private final SpreadsheetReader spreadsheetReader;
    private final DelimitedTextReader delimitedTextReader;
    private final PdfContentExtractor pdfContentExtractor;
    private final PlainTextSectioner plainTextSectioner;
    private final TabularContentFormatter tabularContentFormatter;

    public PreprocessedContent preprocess(RawDocument document) {
        String filename = document.filename();
        if (document.size() == 0) {
            log.warn("[Preprocessor] Empty document: {}", filename);
            return PreprocessedContent.unreadable(DocumentFormat.UNKNOWN, filename, "Document is empty (0 bytes)");
        }

        DocumentFormat format = formatResolver.resolve(document.bytes(), filename, document.formatHint());
        log.info("[Preprocessor] {} resolved as {} ({} bytes)", filename, format, document.size());

        if (format == DocumentFormat.UNKNOWN) {
            return PreprocessedContent.unreadable(format, filename, "Unsupported file type: " + filename);
        }

        try {
            PreprocessedContent.PreprocessedContentBuilder builder = PreprocessedContent.builder()
                    .format(format)
                    .filename(filename)
                    .header(format.name() + " DOCUMENT: " + filename + "\n" + BANNER_RULE);

            switch (format) {
                case XLSX:
                case XLS:
                    buildSpreadsheet(document.bytes(), builder);
                    break;
                case CSV:
                    buildDelimited(document.bytes(), filename, builder);
                    break;
                case PDF:
                    buildPdf(document.bytes(), builder);
                    break;
                default:
                    buildPlainText(document.bytes(), builder);
                    break;
            }

            PreprocessedContent content = builder.build();
            log.info("[Preprocessor] {}", content.getDescription());
            return content;
        } catch (UnsupportedFormatException e) {
            log.warn("[Preprocessor] Unreadable {} ({}): {}", filename, format, e.getMessage());
            return PreprocessedContent.unreadable(format, filename, e.getMessage());
        }
    }

    private void buildSpreadsheet(byte[] bytes, PreprocessedContent.PreprocessedContentBuilder builder) {
        List<TableBlock> sheets = spreadsheetReader.read(bytes);
        StringBuilder body = new StringBuilder();
        boolean statement = false;
        for (TableBlock sheet : sheets) {
            body.append("[SHEET_START] ").append(sheet.name()).append('\n');
            if (!sheet.isEmpty() || !sheet.titleLines().isEmpty()) {
                FormattedTable formatted = tabularContentFormatter.format(sheet);
                body.append(formatted.text());
                builder.lineItems(formatted.lineItems());
                builder.structureIndicators(formatted.indicators());
                statement |= formatted.statementFormat();
            }
            body.append("[SHEET_END]\n");
        }
        builder.structureIndicator("sheets=" + sheets.size());
        builder.body(body.toString()).financialStatementFormat(statement);
    }

    private void buildDelimited(byte[] bytes, String filename, PreprocessedContent.PreprocessedContentBuilder builder) {
        TableBlock table = delimitedTextReader.read(bytes, filename);
        FormattedTable formatted = tabularContentFormatter.format(table);
        builder.body(formatted.text())
                .lineItems(formatted.lineItems())
                .structureIndicators(formatted.indicators())
                .structureIndicator("rows=" + table.rows().size())
                .financialStatementFormat(formatted.statementFormat());
    }

    private void buildPdf(byte[] bytes, PreprocessedContent.PreprocessedContentBuilder builder) {
        List<PdfPage> pages = pdfContentExtractor.extract(bytes);
        StringBuilder body = new StringBuilder();
        boolean statement = false;
        int keywordHits = 0;
        for (PdfPage page : pages) {
            body.append("[PAGE_START] ").append(page.number()).append('\n');
            if (!page.text().isBlank()) {
                body.append("[TEXT_CONTENT]\n").append(page.text()).append('\n');
                keywordHits += FinancialKeywords.countFinancialTerms(page.text());
            }
            if (!page.tables().isEmpty()) {
                body.append("[TABLES_FOUND] ").append(page.tables().size()).append('\n');
                for (int t = 0; t < page.tables().size(); t++) {
                    String name = "page " + page.number() + " table " + (t + 1);
                    TableBlock table = HeaderRowDetector.split(name, page.tables().get(t));
                    FormattedTable formatted = tabularContentFormatter.format(table);
                    body.append("[TABLE_").append(t + 1).append("]\n").append(formatted.text());
                    builder.lineItems(formatted.lineItems());
                    builder.structureIndicators(formatted.indicators());
                    statement |= formatted.statementFormat();
                }
            }
            builder.structureIndicator("page " + page.number() + ": tables=" + page.tables().size());
            body.append("[PAGE_END]\n");
        }
        if (pages.stream().allMatch(p -> p.text().isBlank() && p.tables().isEmpty())) {
            throw new UnsupportedFormatException("PDF has no text layer (scanned images are not supported)");
        }
        builder.structureIndicator("pages=" + pages.size())
                .structureIndicator("financial keyword hits=" + keywordHits)
                .body(body.toString())
                .financialStatementFormat(statement);
    }

    private void buildPlainText(byte[] bytes, PreprocessedContent.PreprocessedContentBuilder builder) {
        if (TextDecoder.looksBinary(bytes)) {
            throw new UnsupportedFormatException("Binary content is not readable as text");
        }
        String text = TextDecoder.decode(bytes);
        String body = plainTextSectioner.section(text);
        builder.body(body)
                .structureIndicator("financial keyword hits=" + FinancialKeywords.countFinancialTerms(text))
                .financialStatementFormat(false);
    }
}

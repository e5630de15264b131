package com.noi.backend.services.extraction.preprocessing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ContentGateConfig;
import com.noi.backend.services.extraction.model.LineItem;
import com.noi.backend.services.extraction.util.AmountParser;
import com.noi.backend.services.extraction.util.FinancialKeywords;

import lombok.RequiredArgsConstructor;

/**
 * Renders one table either as "category: value" statement lines or as a generic grid.
 */
@Component
@RequiredArgsConstructor
public class TabularContentFormatter {

    static final String STATEMENT_MARKER = "[FINANCIAL_STATEMENT_FORMAT]";
    static final String TABLE_MARKER = "[TABLE_FORMAT]";
    static final String EMPTY_CELL = "[EMPTY]";

    private final ColumnRoleDetector columnRoleDetector;
    private final ContentGateConfig config;

    public FormattedTable format(TableBlock table) {
        ColumnRoles roles = columnRoleDetector.detect(table.headers(), table.rows());
        List<String> indicators = new ArrayList<>();
        indicators.add(String.format("%s: columns=%d kept=%d numeric=%d category=%s value=%s%s",
                table.name(),
                table.columnCount(),
                roles.keptColumns().size(),
                roles.numericColumnCount(config.getValueColumnRatio()),
                describe(table, roles.categoryColumn()),
                describe(table, roles.valueColumn()),
                roles.valueColumnDefaulted() ? " (defaulted)" : ""));

        List<LineItem> items = new ArrayList<>();
        boolean statement = isStatement(table, roles);
        StringBuilder sb = new StringBuilder();
        for (String title : table.titleLines()) {
            sb.append(title).append('\n');
        }

        if (statement) {
            sb.append(STATEMENT_MARKER).append('\n');
            sb.append("LINE ITEMS:\n");
        } else {
            sb.append(TABLE_MARKER).append('\n');
            List<String> headerCells = new ArrayList<>();
            for (int c : roles.keptColumns()) headerCells.add(table.header(c));
            sb.append("COLUMN HEADERS: ").append(String.join(" | ", headerCells)).append('\n');
            sb.append("DATA ROWS:\n");
        }

        for (int r = 0; r < table.rows().size(); r++) {
            String label = roles.categoryColumn() >= 0 ? table.cell(r, roles.categoryColumn()) : "";
            BigDecimal value = roles.hasPairs() ? AmountParser.parse(table.cell(r, roles.valueColumn())) : null;
            if (!label.isBlank() && value != null) {
                items.add(new LineItem(label, value));
            }

            if (statement) {
                if (!label.isBlank() && value != null) {
                    sb.append("  ").append(label).append(": ").append(value.toPlainString()).append('\n');
                } else if (!label.isBlank()) {
                    sb.append("  SECTION: ").append(label).append('\n');
                } else if (value != null) {
                    sb.append("  UNLABELED: ").append(value.toPlainString()).append('\n');
                }
            } else {
                List<String> cells = new ArrayList<>();
                boolean any = false;
                for (int c : roles.keptColumns()) {
                    String v = table.cell(r, c);
                    if (v.isBlank()) {
                        cells.add(EMPTY_CELL);
                    } else {
                        cells.add(v);
                        any = true;
                    }
                }
                if (any) sb.append("  ").append(String.join(" | ", cells)).append('\n');
            }
        }

        indicators.add(table.name() + ": " + (statement ? "financial statement format" : "table format")
                + ", line items=" + items.size());
        return new FormattedTable(sb.toString(), items, statement, indicators);
    }

    /**
     * Statement layout needs a label column with financial wording and at most one numeric column;
     * wider tables (months, budget vs actual) keep every column as a grid.
     */
    private boolean isStatement(TableBlock table, ColumnRoles roles) {
        if (!roles.hasPairs()) return false;
        if (roles.numericColumnCount(config.getValueColumnRatio()) > 1) return false;
        for (int r = 0; r < table.rows().size(); r++) {
            if (FinancialKeywords.containsFinancialTerm(table.cell(r, roles.categoryColumn()))) return true;
        }
        return false;
    }

    private static String describe(TableBlock table, int column) {
        if (column < 0) return "none";
        return column + "(" + table.header(column) + ")";
    }

    public record FormattedTable(String text, List<LineItem> lineItems, boolean statementFormat, List<String> indicators) {
    }
}

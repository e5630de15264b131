package com.noi.backend.services.extraction.prompt;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ModelExtractionProperties;
import com.noi.backend.enums.DocumentRole;
import com.noi.backend.services.extraction.model.AttemptStrategy;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.PreprocessedContent;

import lombok.RequiredArgsConstructor;

/**
 * Builds the extraction instructions for one attempt. Each strategy adds to the previous one,
 * so a retry is never the same prompt twice.
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    static final String TRUNCATION_MARKER = "\n... [truncated] ...\n";
    static final String NO_ALL_ZERO_RULE =
            "DO NOT return all zero values. If the document shows nonzero figures, the answer must contain them.";

    private final ModelExtractionProperties properties;

    public String build(PreprocessedContent content, DocumentRole role, AttemptStrategy strategy) {
        StringBuilder sb = new StringBuilder();
        sb.append("You extract figures from a real-estate property operating statement.\n");
        sb.append(roleInstructions(role)).append("\n\n");

        sb.append("Return a JSON object with exactly these keys. Use a number for every value found and null ")
                .append("for every value not present in the document:\n");
        sb.append(schema()).append('\n');

        sb.append("LABEL SYNONYMS (any of these in the document means the key on the left):\n");
        for (FinancialField f : FinancialField.values()) {
            sb.append("- ").append(f.getKey()).append(": ").append(String.join(", ", f.getSynonyms())).append('\n');
        }
        sb.append('\n');

        sb.append("DERIVATION RULES:\n");
        sb.append("- egi = gpr - vacancy_loss - concessions - bad_debt + other_income, when egi is not stated.\n");
        sb.append("- noi = egi - opex, when noi is not stated.\n");
        sb.append("- opex is the total of operating expenses; if only individual expenses are listed, add them up.\n");
        sb.append("- other_income is the total of non-rent income items (parking, laundry, fees, ...).\n\n");

        sb.append("SIGN RULES:\n");
        sb.append("- A value in parentheses, like (1,234.56), or with a trailing minus, like 1,234.56-, is negative.\n");
        sb.append("- Report vacancy_loss, concessions, bad_debt and all expenses as positive amounts.\n");
        sb.append("- egi and noi keep their sign; a loss is a negative noi.\n");
        sb.append("- Drop currency symbols and thousands separators: 30000.00, not \"$30,000.00\".\n\n");

        sb.append("RULES:\n");
        sb.append("- ").append(NO_ALL_ZERO_RULE).append('\n');
        sb.append("- Respond with the JSON object only. No explanations, no markdown, no code fences.\n");

        if (content.isFinancialStatementFormat()) {
            sb.append("- The document is in financial statement format: lines under LINE ITEMS read \"category: value\".\n");
        }

        if (strategy == AttemptStrategy.EMPHATIC || strategy == AttemptStrategy.WORKED_EXAMPLE) {
            sb.append("\nIMPORTANT - the previous answer was rejected.\n");
            sb.append("- ").append(NO_ALL_ZERO_RULE).append('\n');
            sb.append("- Read every line that has a number. Match its label against the synonyms above.\n");
            sb.append("- Include all four keys gpr, egi, opex and noi, even when a value is null.\n");
        }
        if (strategy == AttemptStrategy.WORKED_EXAMPLE) {
            sb.append(workedExample());
        }

        sb.append("\nDOCUMENT:\n");
        sb.append(truncate(content.promptText(), properties.getMaxPromptChars()));
        return sb.toString();
    }

    static String roleInstructions(DocumentRole role) {
        DocumentRole r = role == null ? DocumentRole.CURRENT : role;
        switch (r) {
            case BUDGET:
                return "This is a BUDGET document: the figures are projected amounts for the period. "
                        + "Extract the budgeted values, not actuals or variances.";
            case PRIOR:
                return "This is a PRIOR PERIOD document: the figures are historical actuals for the previous month. "
                        + "Extract the actual amounts.";
            case PRIOR_YEAR:
                return "This is a PRIOR YEAR document: the figures are historical actuals for the same period last year. "
                        + "Extract the actual amounts.";
            default:
                return "This is a CURRENT PERIOD document: extract the actual amounts for the current period, "
                        + "not budget or variance columns.";
        }
    }

    static String schema() {
        StringBuilder sb = new StringBuilder("{\n");
        FinancialField[] all = FinancialField.values();
        for (int i = 0; i < all.length; i++) {
            sb.append("  \"").append(all[i].getKey()).append("\": null");
            if (i < all.length - 1) sb.append(',');
            sb.append("  // ").append(all[i].getLabel()).append('\n');
        }
        return sb.append('}').toString();
    }

    private static String workedExample() {
        return "\nEXAMPLE\n"
                + "Input lines:\n"
                + "  Gross Potential Rent: 50,000.00\n"
                + "  Vacancy Loss: (2,500.00)\n"
                + "  Parking Income: 1,200.00\n"
                + "  Property Taxes: 6,000.00\n"
                + "  Insurance: 2,000.00\n"
                + "Output:\n"
                + "{\"gpr\": 50000.00, \"vacancy_loss\": 2500.00, \"concessions\": null, \"bad_debt\": null, "
                + "\"other_income\": 1200.00, \"parking\": 1200.00, \"egi\": 48700.00, \"property_taxes\": 6000.00, "
                + "\"insurance\": 2000.00, \"opex\": 8000.00, \"noi\": 40700.00}\n"
                + "(keys not shown in the example are null)\n";
    }

    /**
     * Keeps 70% of the budget from the head and the rest from the tail.
     */
    static String truncate(String text, int maxChars) {
        if (text == null) return "";
        if (maxChars <= 0 || text.length() <= maxChars) return text;
        int budget = Math.max(0, maxChars - TRUNCATION_MARKER.length());
        int head = (int) (budget * 0.7);
        int tail = budget - head;
        return text.substring(0, head) + TRUNCATION_MARKER + text.substring(text.length() - tail);
    }
}

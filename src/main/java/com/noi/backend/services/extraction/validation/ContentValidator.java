package com.noi.backend.services.extraction.validation;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.noi.backend.config.ContentGateConfig;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.util.AmountParser;
import com.noi.backend.services.extraction.util.AmountParser.AmountToken;
import com.noi.backend.services.extraction.util.FinancialKeywords;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether content holds real figures or is an empty template. Only the body is scanned;
 * the banner (filename, format) never counts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentValidator {

    private final ContentGateConfig config;

    public ContentValidation validate(PreprocessedContent content) {
        if (content == null || !content.isReadable()) {
            String reason = content == null ? "No content" : content.getFailureReason();
            log.warn("[ContentValidator] REJECTED: unreadable content ({})", reason);
            return new ContentValidation(false, reason, 0, 0);
        }

        BigDecimal threshold = config.getMaterialityThreshold();
        int material = 0;
        int keywordAdjacent = 0;

        for (String line : content.bodyOrEmpty().split("\\r?\\n")) {
            List<AmountToken> tokens = AmountParser.findAll(line);
            for (AmountToken token : tokens) {
                if (token.isYearLike() || !token.exceeds(threshold)) continue;
                material++;
                if (FinancialKeywords.containsFinancialTerm(line.substring(0, token.start()))) {
                    keywordAdjacent++;
                }
            }
        }

        boolean pass = material >= config.getMinMaterialValues()
                || (config.getMinKeywordAdjacentValues() > 0 && keywordAdjacent >= config.getMinKeywordAdjacentValues());

        String reason;
        if (pass) {
            reason = String.format("Found %d material values (%d next to financial labels)", material, keywordAdjacent);
            log.info("[ContentValidator] ACCEPTED: {}", reason);
        } else if (material == 0) {
            reason = String.format("No values above %s found; the document looks like an empty template", threshold);
            log.warn("[ContentValidator] REJECTED: {} ({})", reason, config.getDescription());
        } else {
            reason = String.format("Only %d material values and none next to a financial label (need %d)",
                    material, config.getMinMaterialValues());
            log.warn("[ContentValidator] REJECTED: {} ({})", reason, config.getDescription());
        }
        return new ContentValidation(pass, reason, material, keywordAdjacent);
    }
}

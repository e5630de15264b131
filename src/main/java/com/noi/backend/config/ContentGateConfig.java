package com.noi.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Thresholds for the financial-content gate and for column role detection.
 * Loaded from application.properties with prefix "extraction.content".
 *
 * Example:
 * extraction.content.materiality-threshold=100
 * extraction.content.min-material-values=3
 * extraction.content.min-keyword-adjacent-values=1
 * extraction.content.value-column-ratio=0.5
 * extraction.content.placeholder-column-keep-ratio=0.1
 */
@Data
@Component
@ConfigurationProperties(prefix = "extraction.content")
public class ContentGateConfig {

    /**
     * Smallest magnitude treated as real money (strictly greater than).
     */
    private BigDecimal materialityThreshold = new BigDecimal("100");

    /**
     * Material values needed to pass without any keyword support.
     */
    private int minMaterialValues = 3;

    /**
     * Material values on lines labelled with a financial keyword needed to pass on their own.
     */
    private int minKeywordAdjacentValues = 1;

    /**
     * Share of numeric cells above which a column is the value column.
     */
    private double valueColumnRatio = 0.5;

    /**
     * Placeholder-named columns are dropped only below this numeric share.
     */
    private double placeholderColumnKeepRatio = 0.1;

    public String getDescription() {
        return String.format(
                "ContentGateConfig{materiality>%s, minValues=%d, minKeywordValues=%d, valueRatio=%.2f, placeholderKeep=%.2f}",
                materialityThreshold,
                minMaterialValues,
                minKeywordAdjacentValues,
                valueColumnRatio,
                placeholderColumnKeepRatio);
    }
}

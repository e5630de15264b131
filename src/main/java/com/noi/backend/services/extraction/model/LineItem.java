package com.noi.backend.services.extraction.model;

import java.math.BigDecimal;

/**
 * A (category, value) pair recovered from a table row.
 */
public record LineItem(String category, BigDecimal value) {
}

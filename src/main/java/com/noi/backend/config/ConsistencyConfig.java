package com.noi.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Accounting identity tolerance ("extraction.consistency").
 *
 * The tolerance is absolute, in currency units, and applies to every identity and
 * component check alike.
 */
@Data
@Component
@ConfigurationProperties(prefix = "extraction.consistency")
public class ConsistencyConfig {

    private BigDecimal tolerance = new BigDecimal("1.00");
}

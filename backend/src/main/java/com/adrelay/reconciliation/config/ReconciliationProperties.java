package com.adrelay.reconciliation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Matching rules. Documented in application.yml under adrelay.reconciliation.
 */
@ConfigurationProperties(prefix = "adrelay.reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Accepted shortfall in percent of the expected amount (network fees). Default 2: amount >= 98% matches. */
    private BigDecimal amountTolerancePercent = new BigDecimal("2");

    /** Period of the sweep over unprocessed observed transactions. Default 60. */
    private long sweepIntervalSeconds = 60L;

    /** Unprocessed rows loaded per reconciliation pass. Default 200. */
    private int batchSize = 200;
}

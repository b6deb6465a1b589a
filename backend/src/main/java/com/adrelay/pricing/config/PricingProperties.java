package com.adrelay.pricing.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Pricing rates and limits. Documented in application.yml under adrelay.pricing.
 */
@ConfigurationProperties(prefix = "adrelay.pricing")
@NoArgsConstructor
@Getter
@Setter
public class PricingProperties {

    /** Price of one post in one channel, in ledger currency. Also the floor of any final cost. Default 0.29. */
    private BigDecimal baseRatePerPostPerDay = new BigDecimal("0.29");

    /** Discount ceiling in percent. Default 25. */
    private BigDecimal maxDiscountPercent = new BigDecimal("25");

    /** Discount percent earned per day of duration. Default 0.8. */
    private BigDecimal discountRatePerDay = new BigDecimal("0.8");

    /** Cadence ceiling. Default 12 posts per day. */
    private int maxPostsPerDay = 12;

    /** Fraction digits of the final cost (rounded down). Default 2. */
    private int amountScale = 2;

    /** Accepted duration range, inclusive. */
    private int minDurationDays = 1;
    private int maxDurationDays = 365;
}

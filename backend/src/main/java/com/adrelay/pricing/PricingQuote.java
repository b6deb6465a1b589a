package com.adrelay.pricing;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.List;

/**
 * Commercial terms for (durationDays, channelCount). scheduleTimes holds postsPerDay marks starting at 00:00.
 */
public record PricingQuote(
        int durationDays,
        int channelCount,
        int postsPerDay,
        BigDecimal discountPercent,
        BigDecimal baseCost,
        BigDecimal finalCost,
        List<LocalTime> scheduleTimes,
        int totalPosts
) {
}

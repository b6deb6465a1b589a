package com.adrelay.api.dto;

import com.adrelay.pricing.PricingQuote;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.List;

public record PricingQuoteResponse(
        int durationDays,
        int channelCount,
        int postsPerDay,
        BigDecimal discountPercent,
        BigDecimal baseCost,
        BigDecimal finalCost,
        List<String> scheduleTimes,
        int totalPosts
) {

    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public static PricingQuoteResponse from(PricingQuote q) {
        return new PricingQuoteResponse(
                q.durationDays(),
                q.channelCount(),
                q.postsPerDay(),
                q.discountPercent(),
                q.baseCost(),
                q.finalCost(),
                q.scheduleTimes().stream().map(SLOT_FORMAT::format).toList(),
                q.totalPosts());
    }
}

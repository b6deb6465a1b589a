package com.adrelay.api.dto;

import com.adrelay.domain.Order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Order as returned by POST /orders and GET /orders/{referenceCode}. The buyer pays expectedAmount to
 * receivingAddress with referenceCode as the transfer comment before expiresAt.
 */
public record OrderResponse(
        String orderId,
        String referenceCode,
        String receivingAddress,
        BigDecimal expectedAmount,
        int durationDays,
        List<String> channelIds,
        int postsPerDay,
        BigDecimal discountPercent,
        String status,
        Instant createdAt,
        Instant expiresAt,
        String matchedTxId,
        Instant matchedAt
) {

    public static OrderResponse from(Order o) {
        return new OrderResponse(
                o.getId(),
                o.getReferenceCode(),
                o.getReceivingAddress(),
                o.getExpectedAmount(),
                o.getDurationDays(),
                o.getChannelIds(),
                o.getPostsPerDay(),
                o.getDiscountPercent(),
                o.getStatus() != null ? o.getStatus().name() : null,
                o.getCreatedAt(),
                o.getExpiresAt(),
                o.getMatchedTxId(),
                o.getMatchedAt());
    }
}

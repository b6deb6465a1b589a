package com.adrelay.api.dto;

import com.adrelay.domain.Campaign;

import java.time.Instant;
import java.util.List;

public record CampaignResponse(
        String campaignId,
        String orderId,
        String userId,
        String referenceCode,
        List<String> channelIds,
        int durationDays,
        int postsPerDay,
        int totalPosts,
        Instant startsAt,
        Instant createdAt,
        Instant confirmationEmittedAt
) {

    public static CampaignResponse from(Campaign c) {
        return new CampaignResponse(
                c.getId(),
                c.getOrderId(),
                c.getUserId(),
                c.getReferenceCode(),
                c.getChannelIds(),
                c.getDurationDays(),
                c.getPostsPerDay(),
                c.getTotalPosts(),
                c.getStartsAt(),
                c.getCreatedAt(),
                c.getConfirmationEmittedAt());
    }
}

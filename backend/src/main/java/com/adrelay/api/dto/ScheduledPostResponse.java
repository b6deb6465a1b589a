package com.adrelay.api.dto;

import com.adrelay.domain.ScheduledPost;

import java.time.Instant;

public record ScheduledPostResponse(
        String postId,
        String campaignId,
        String channelId,
        int dayIndex,
        int slotIndex,
        String slotTime,
        Instant absoluteTimestamp,
        String status,
        String failureReason
) {

    public static ScheduledPostResponse from(ScheduledPost p) {
        return new ScheduledPostResponse(
                p.getId(),
                p.getCampaignId(),
                p.getChannelId(),
                p.getDayIndex(),
                p.getSlotIndex(),
                p.getSlotTime(),
                p.getAbsoluteTimestamp(),
                p.getStatus() != null ? p.getStatus().name() : null,
                p.getFailureReason());
    }
}

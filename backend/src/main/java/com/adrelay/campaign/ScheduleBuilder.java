package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.ScheduledPost;
import com.adrelay.domain.ScheduledPostStatus;
import com.adrelay.pricing.PricingEngine;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a campaign into day x channel x slot posts. absoluteTimestamp = startsAt + day * 24h + slot offset.
 */
public final class ScheduleBuilder {

    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private ScheduleBuilder() {
    }

    public static List<ScheduledPost> build(Campaign campaign, Instant createdAt) {
        List<LocalTime> slots = PricingEngine.scheduleTimes(campaign.getPostsPerDay());
        List<ScheduledPost> posts = new ArrayList<>(campaign.getDurationDays() * slots.size() * campaign.getChannelIds().size());
        for (int day = 0; day < campaign.getDurationDays(); day++) {
            Instant dayStart = campaign.getStartsAt().plus(Duration.ofDays(day));
            for (String channelId : campaign.getChannelIds()) {
                for (int slot = 0; slot < slots.size(); slot++) {
                    LocalTime time = slots.get(slot);
                    ScheduledPost post = new ScheduledPost();
                    post.setCampaignId(campaign.getId());
                    post.setChannelId(channelId);
                    post.setDayIndex(day);
                    post.setSlotIndex(slot);
                    post.setSlotTime(SLOT_FORMAT.format(time));
                    post.setAbsoluteTimestamp(dayStart.plusSeconds(time.toSecondOfDay()));
                    post.setStatus(ScheduledPostStatus.SCHEDULED);
                    post.setStatusUpdatedAt(createdAt);
                    posts.add(post);
                }
            }
        }
        return posts;
    }
}

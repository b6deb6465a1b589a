package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.ScheduledPost;
import com.adrelay.domain.ScheduledPostRepository;
import com.adrelay.domain.ScheduledPostStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read and update entry point for the external publisher. Posts move SCHEDULED -> PUBLISHED | FAILED once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledPostService {

    public static final int MAX_DUE_LIMIT = 500;

    private final ScheduledPostRepository scheduledPostRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    public List<ScheduledPost> findDue(Instant dueBy, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_DUE_LIMIT));
        return scheduledPostRepository.findByStatusAndAbsoluteTimestampLessThanEqualOrderByAbsoluteTimestampAsc(
                ScheduledPostStatus.SCHEDULED, dueBy, PageRequest.of(0, size));
    }

    public List<ScheduledPost> findDueNow(int limit) {
        return findDue(clock.instant(), limit);
    }

    public Optional<Campaign> findCampaign(String campaignId) {
        return campaignRepository.findById(campaignId);
    }

    public Optional<Campaign> findCampaignByOrderId(String orderId) {
        return campaignRepository.findByOrderId(orderId);
    }

    public Optional<ScheduledPost> findPost(String postId) {
        return scheduledPostRepository.findById(postId);
    }

    public List<ScheduledPost> findByCampaign(String campaignId) {
        return scheduledPostRepository.findByCampaignIdOrderByAbsoluteTimestampAsc(campaignId);
    }

    /**
     * Empty when the post does not exist or is no longer SCHEDULED.
     */
    public Optional<ScheduledPost> markPublished(String postId) {
        Optional<ScheduledPost> updated = scheduledPostRepository.completeScheduled(
                postId, ScheduledPostStatus.PUBLISHED, null, clock.instant());
        updated.ifPresent(p -> log.debug("Post {} published in channel {}", p.getId(), p.getChannelId()));
        return updated;
    }

    public Optional<ScheduledPost> markFailed(String postId, String reason) {
        Optional<ScheduledPost> updated = scheduledPostRepository.completeScheduled(
                postId, ScheduledPostStatus.FAILED, reason, clock.instant());
        updated.ifPresent(p -> log.warn("Post {} failed in channel {}: {}", p.getId(), p.getChannelId(), reason));
        return updated;
    }
}

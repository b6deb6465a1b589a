package com.adrelay.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ScheduledPostRepository extends MongoRepository<ScheduledPost, String>, ScheduledPostRepositoryCustom {

    long countByCampaignId(String campaignId);

    List<ScheduledPost> findByCampaignIdOrderByAbsoluteTimestampAsc(String campaignId);

    List<ScheduledPost> findByCampaignIdAndStatusOrderByAbsoluteTimestampAsc(String campaignId, ScheduledPostStatus status);

    List<ScheduledPost> findByStatusAndAbsoluteTimestampLessThanEqualOrderByAbsoluteTimestampAsc(
            ScheduledPostStatus status, Instant dueBy, Pageable pageable);
}

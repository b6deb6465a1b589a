package com.adrelay.domain;

import java.time.Instant;
import java.util.Optional;

public interface ScheduledPostRepositoryCustom {

    /**
     * SCHEDULED -> target status. Empty when the post is unknown or no longer SCHEDULED.
     */
    Optional<ScheduledPost> completeScheduled(String postId, ScheduledPostStatus target, String failureReason, Instant now);
}

package com.adrelay.domain;

import java.time.Instant;

/**
 * Targeted updates for poll cursors.
 */
public interface PollCursorRepositoryCustom {

    /**
     * Returns the cursor for the address, creating an empty one on first use.
     */
    PollCursor ensureCursor(String receivingAddress, Instant now);

    /**
     * Moves the position forward to seenAt; a position at or after seenAt is left alone.
     */
    boolean advance(String receivingAddress, Instant seenAt, String txId, Long logicalTime, Instant now);

    void saveResumePoint(String receivingAddress, PollCursor.ResumePoint resumePoint, Instant now);

    void clearResumePoint(String receivingAddress, Instant now);

    void recordFailure(String receivingAddress, int consecutiveFailures, Instant nextAttemptAfter, String error, Instant now);

    void recordSuccess(String receivingAddress, Instant now);
}

package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Poll position and failure state per receiving address. Position (lastSeenAt, lastTxId, lastLogicalTime)
 * and failure fields are written by separate updates, so a failed cycle never moves the position.
 * lastSeenAt only moves once a read window was read back to its start; until then resumePoint marks
 * where the unfinished window continues.
 */
@Document(collection = "poll_cursors")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PollCursor {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String receivingAddress;
    /** Ledger timestamp of the newest transfer handed off to reconciliation. */
    private Instant lastSeenAt;
    private String lastTxId;
    private Long lastLogicalTime;
    private int consecutiveFailures;
    private Instant nextAttemptAfter;
    private String lastError;
    private ResumePoint resumePoint;
    private Instant updatedAt;

    /**
     * An unfinished read window: older transactions back to {@code until} are still to be read, strictly
     * before (afterLogicalTime, afterHash). head* is the position lastSeenAt takes once the window is done.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ResumePoint {
        private Instant until;
        private long afterLogicalTime;
        private String afterHash;
        private Instant headAt;
        private String headTxId;
        private Long headLogicalTime;
    }
}

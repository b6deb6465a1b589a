package com.adrelay.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * What reconciliation decided for an observed transaction.
 */
public enum ReconciliationOutcome {
    /** Correlated with a pending order and matched it. */
    MATCHED,
    /** Memo does not belong to any order. */
    UNTRACKED,
    /** Memo belongs to an order that was no longer pending (expired, matched, cancelled). */
    LATE,
    /** Memo matched a pending order but the amount was below tolerance. */
    UNDERPAID,
    /** Lost the match race for an order that another transaction matched first. */
    CONFLICTED,
    /** Matched by an administrator through the audited admin API. */
    MATCHED_MANUALLY,
    /** Administrator recorded that the payer was refunded. */
    REFUNDED,
    /** Administrator closed the case without a match or refund. */
    RESOLVED_MANUALLY;

    /** Outcomes left for manual reconciliation. */
    public static final Set<ReconciliationOutcome> UNRESOLVED = EnumSet.of(UNTRACKED, LATE, UNDERPAID, CONFLICTED);

    /** Outcomes an administrator may close an unresolved transaction with. */
    public static final Set<ReconciliationOutcome> RESOLUTIONS = EnumSet.of(REFUNDED, RESOLVED_MANUALLY);
}

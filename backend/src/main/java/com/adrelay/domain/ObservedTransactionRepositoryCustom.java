package com.adrelay.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Conditional writes for observed transactions.
 */
public interface ObservedTransactionRepositoryCustom {

    /**
     * Insert unless a row with the same txId exists. Returns true when this call inserted it.
     */
    boolean insertIfAbsent(ObservedTransaction transaction);

    /**
     * processed=false -> true with the given outcome. Empty when the row was already processed (or is unknown).
     */
    Optional<ObservedTransaction> markProcessed(String txId, ReconciliationOutcome outcome, String orderId,
                                                String note, Instant now);

    /**
     * Changes the outcome of a processed row whose current outcome is one of {@code expected}.
     */
    Optional<ObservedTransaction> changeOutcome(String txId, Collection<ReconciliationOutcome> expected,
                                                ReconciliationOutcome outcome, String orderId, String note, Instant now);
}

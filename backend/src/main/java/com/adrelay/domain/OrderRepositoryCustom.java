package com.adrelay.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Compare-and-swap transitions on orders. Each call is a single conditional update on the server; a result
 * is present only when this caller performed the transition.
 */
public interface OrderRepositoryCustom {

    /**
     * PENDING and not yet expired at {@code now} -> MATCHED, stamping the transaction id and match time.
     */
    Optional<Order> tryMatch(String orderId, String txId, Instant now);

    /**
     * PENDING with expiresAt <= now -> EXPIRED. Returns the number of orders transitioned.
     */
    long expireStale(Instant now);

    /**
     * PENDING -> CANCELLED. When userId is non-null the order must belong to that user.
     */
    Optional<Order> cancel(String orderId, String userId, Instant now);

    /**
     * Stamps provisionedAt on a MATCHED order that does not have it yet. Returns true when this call stamped it.
     */
    boolean markProvisioned(String orderId, Instant now);
}

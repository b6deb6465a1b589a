package com.adrelay.domain;

/**
 * Order lifecycle. Only PENDING has outgoing transitions; the other three are terminal.
 */
public enum OrderStatus {
    PENDING,
    MATCHED,
    EXPIRED,
    CANCELLED
}

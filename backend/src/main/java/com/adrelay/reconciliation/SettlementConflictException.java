package com.adrelay.reconciliation;

import lombok.Getter;

/**
 * The observed transaction changed state while its order was being matched; the enclosing transaction rolls
 * back so the order stays PENDING.
 */
@Getter
public class SettlementConflictException extends RuntimeException {

    private final String txId;

    public SettlementConflictException(String txId, String message) {
        super(message);
        this.txId = txId;
    }
}

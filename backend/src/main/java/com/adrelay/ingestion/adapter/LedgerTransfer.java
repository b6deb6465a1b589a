package com.adrelay.ingestion.adapter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Incoming transfer as read from the ledger; amount already converted from base units.
 */
public record LedgerTransfer(
        String txId,
        long logicalTime,
        String fromAddress,
        String toAddress,
        BigDecimal amount,
        String memo,
        Instant timestamp
) {
}

package com.adrelay.api.dto;

import com.adrelay.domain.ObservedTransaction;

import java.math.BigDecimal;
import java.time.Instant;

public record ObservedTransactionResponse(
        String txId,
        String receivingAddress,
        String fromAddress,
        BigDecimal amount,
        String memo,
        Instant observedAt,
        String outcome,
        String orderId,
        Instant processedAt,
        String note
) {

    public static ObservedTransactionResponse from(ObservedTransaction t) {
        return new ObservedTransactionResponse(
                t.getTxId(),
                t.getReceivingAddress(),
                t.getFromAddress(),
                t.getAmount(),
                t.getMemo(),
                t.getObservedAt(),
                t.getOutcome() != null ? t.getOutcome().name() : null,
                t.getOrderId(),
                t.getProcessedAt(),
                t.getNote());
    }
}

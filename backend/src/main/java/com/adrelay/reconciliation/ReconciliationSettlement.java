package com.adrelay.reconciliation;

import com.adrelay.domain.ObservedTransactionRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderRepository;
import com.adrelay.domain.ReconciliationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * The atomic match unit: order PENDING -> MATCHED and the transaction's outcome change commit together or not at
 * all. Shared by automatic matching and administrative force-match.
 */
@Component
@RequiredArgsConstructor
public class ReconciliationSettlement {

    private final OrderRepository orderRepository;
    private final ObservedTransactionRepository observedTransactionRepository;

    /**
     * Matches the order with an unprocessed transaction and flips it processed with outcome MATCHED.
     *
     * @return the matched order; empty when the order was no longer matchable (nothing written)
     * @throws SettlementConflictException the transaction was already processed; the match is rolled back
     */
    @Transactional
    public Optional<Order> settle(String txId, String orderId, Instant now) {
        Optional<Order> matched = orderRepository.tryMatch(orderId, txId, now);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        observedTransactionRepository.markProcessed(txId, ReconciliationOutcome.MATCHED, orderId, null, now)
                .orElseThrow(() -> new SettlementConflictException(txId, "Transaction " + txId + " already processed"));
        return matched;
    }

    /**
     * Matches the order with a processed, unresolved transaction and re-labels it MATCHED_MANUALLY.
     *
     * @throws SettlementConflictException the transaction is no longer unresolved; the match is rolled back
     */
    @Transactional
    public Optional<Order> settleManually(String txId, String orderId, String note, Instant now) {
        Optional<Order> matched = orderRepository.tryMatch(orderId, txId, now);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        observedTransactionRepository.changeOutcome(txId, ReconciliationOutcome.UNRESOLVED,
                        ReconciliationOutcome.MATCHED_MANUALLY, orderId, note, now)
                .orElseThrow(() -> new SettlementConflictException(txId, "Transaction " + txId + " is no longer unresolved"));
        return matched;
    }
}

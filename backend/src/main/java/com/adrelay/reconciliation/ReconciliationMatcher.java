package com.adrelay.reconciliation;

import com.adrelay.campaign.CampaignFulfillment;
import com.adrelay.domain.Campaign;
import com.adrelay.domain.ObservedTransaction;
import com.adrelay.domain.ObservedTransactionRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderStatus;
import com.adrelay.domain.ReconciliationOutcome;
import com.adrelay.order.OrderLedgerService;
import com.adrelay.order.ReferenceCodeGenerator;
import com.adrelay.reconciliation.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Correlates observed transactions with orders by reference code. Every unprocessed transaction ends processed
 * with exactly one outcome; only a MATCHED outcome leads to provisioning and confirmation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationMatcher {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ObservedTransactionRepository observedTransactionRepository;
    private final OrderLedgerService orderLedgerService;
    private final ReconciliationSettlement settlement;
    private final CampaignFulfillment campaignFulfillment;
    private final ReconciliationProperties properties;
    private final Clock clock;

    /**
     * Reconciles the unprocessed transactions of one receiving address, oldest first.
     */
    public int reconcileAddress(String receivingAddress) {
        return reconcileAll(observedTransactionRepository.findByReceivingAddressAndProcessedFalseOrderByObservedAtAsc(
                receivingAddress, PageRequest.of(0, batchSize())));
    }

    /**
     * Drains unprocessed transactions of every address; picks up hand-offs whose reconciliation failed.
     */
    public int reconcilePending() {
        return reconcileAll(observedTransactionRepository.findByProcessedFalseOrderByObservedAtAsc(
                PageRequest.of(0, batchSize())));
    }

    private int reconcileAll(List<ObservedTransaction> batch) {
        int processed = 0;
        for (ObservedTransaction tx : batch) {
            try {
                if (reconcile(tx).isPresent()) {
                    processed++;
                }
            } catch (DataAccessException e) {
                log.warn("Reconciliation of {} failed, left for the next pass: {}", tx.getTxId(), e.getMessage());
            }
        }
        return processed;
    }

    /**
     * @return the outcome recorded by this call; empty when another caller had already processed the transaction
     * or the match has to be retried
     */
    public Optional<ReconciliationOutcome> reconcile(ObservedTransaction tx) {
        Instant now = clock.instant();
        String code = ReferenceCodeGenerator.normalize(tx.getMemo());
        Optional<Order> candidate = ReferenceCodeGenerator.isWellFormed(code)
                ? orderLedgerService.findByReferenceCode(code)
                : Optional.empty();
        if (candidate.isEmpty()) {
            return record(tx, ReconciliationOutcome.UNTRACKED, null, "no order for memo " + tx.getMemo(), now);
        }
        Order order = candidate.get();
        if (paidBeforeCreation(tx, order)) {
            // the code has been reissued since this payment
            Optional<Order> owner = orderLedgerService.findByReferenceCodeAt(code, tx.getObservedAt());
            if (owner.isEmpty()) {
                return record(tx, ReconciliationOutcome.UNTRACKED, null,
                        "memo " + code + " paid at " + tx.getObservedAt() + " before any order carried it", now);
            }
            return record(tx, ReconciliationOutcome.LATE, owner.get().getId(),
                    "paid at " + tx.getObservedAt() + " for order " + owner.get().getStatus()
                            + "; code reissued to order " + order.getId(), now);
        }
        if (order.getStatus() != OrderStatus.PENDING || !order.getExpiresAt().isAfter(now)) {
            return record(tx, ReconciliationOutcome.LATE, order.getId(),
                    "order " + order.getStatus() + ", expires " + order.getExpiresAt(), now);
        }
        if (isUnderpaid(tx.getAmount(), order.getExpectedAmount())) {
            return record(tx, ReconciliationOutcome.UNDERPAID, order.getId(),
                    "paid " + tx.getAmount() + " of " + order.getExpectedAmount(), now);
        }
        checkPayer(order, tx);
        return match(tx, order, now);
    }

    /**
     * Ledger timestamps have second precision.
     */
    private static boolean paidBeforeCreation(ObservedTransaction tx, Order order) {
        return tx.getObservedAt() != null && order.getCreatedAt() != null
                && tx.getObservedAt().isBefore(order.getCreatedAt().truncatedTo(ChronoUnit.SECONDS));
    }

    private Optional<ReconciliationOutcome> match(ObservedTransaction tx, Order order, Instant now) {
        Optional<Order> matched;
        try {
            matched = settlement.settle(tx.getTxId(), order.getId(), now);
        } catch (SettlementConflictException e) {
            log.info("Duplicate delivery of {} ignored: {}", tx.getTxId(), e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            return resolveAfterFailedSettlement(tx, order, e);
        }
        if (matched.isEmpty()) {
            return recordLoss(tx, order.getId());
        }
        log.info("Transaction {} matched order {} (ref {}, amount {})",
                tx.getTxId(), order.getId(), order.getReferenceCode(), tx.getAmount());
        fulfil(matched.get());
        return Optional.of(ReconciliationOutcome.MATCHED);
    }

    /**
     * A rolled-back settlement (e.g. a write conflict with a concurrent match) is classified once the winner is
     * visible; otherwise the row stays unprocessed for the sweep.
     */
    private Optional<ReconciliationOutcome> resolveAfterFailedSettlement(ObservedTransaction tx, Order order,
                                                                         DataAccessException cause) {
        Optional<Order> current = orderLedgerService.findById(order.getId());
        if (current.isPresent() && current.get().getStatus() != OrderStatus.PENDING
                && !tx.getTxId().equals(current.get().getMatchedTxId())) {
            return recordLoss(tx, order.getId());
        }
        log.warn("Settlement of {} against order {} failed, retrying later: {}",
                tx.getTxId(), order.getId(), cause.getMessage());
        return Optional.empty();
    }

    private Optional<ReconciliationOutcome> recordLoss(ObservedTransaction tx, String orderId) {
        Optional<Order> current = orderLedgerService.findById(orderId);
        boolean expired = current.map(o -> o.getStatus() == OrderStatus.EXPIRED
                || (o.getStatus() == OrderStatus.PENDING && !o.getExpiresAt().isAfter(clock.instant())))
                .orElse(false);
        ReconciliationOutcome outcome = expired ? ReconciliationOutcome.LATE : ReconciliationOutcome.CONFLICTED;
        log.info("Transaction {} lost the match for order {}: {}", tx.getTxId(), orderId, outcome);
        return record(tx, outcome, orderId,
                "order " + current.map(o -> o.getStatus().name()).orElse("missing") + " at match time", clock.instant());
    }

    private void fulfil(Order order) {
        try {
            Campaign campaign = campaignFulfillment.fulfill(order);
            log.info("Order {} fulfilled with campaign {}", order.getId(), campaign.getId());
        } catch (RuntimeException e) {
            log.error("Provisioning failed for matched order {}; left MATCHED for retry", order.getId(), e);
        }
    }

    private Optional<ReconciliationOutcome> record(ObservedTransaction tx, ReconciliationOutcome outcome,
                                                   String orderId, String note, Instant now) {
        if (observedTransactionRepository.markProcessed(tx.getTxId(), outcome, orderId, note, now).isEmpty()) {
            log.debug("Transaction {} already processed", tx.getTxId());
            return Optional.empty();
        }
        if (outcome != ReconciliationOutcome.CONFLICTED) {
            log.info("Transaction {} recorded as {}: {}", tx.getTxId(), outcome, note);
        }
        return Optional.of(outcome);
    }

    boolean isUnderpaid(BigDecimal amount, BigDecimal expected) {
        if (amount == null) {
            return true;
        }
        BigDecimal tolerance = properties.getAmountTolerancePercent();
        BigDecimal minimum = expected.multiply(BigDecimal.ONE.subtract(tolerance.divide(HUNDRED)));
        return amount.compareTo(minimum) < 0;
    }

    private static void checkPayer(Order order, ObservedTransaction tx) {
        String claimed = order.getClaimedPayerAddress();
        if (claimed != null && !PayerAddressCheck.sameAccount(claimed, tx.getFromAddress())) {
            log.warn("Order {} paid from {} but buyer declared {}; matching anyway",
                    order.getId(), tx.getFromAddress(), claimed);
        }
    }

    private int batchSize() {
        return Math.max(1, properties.getBatchSize());
    }
}

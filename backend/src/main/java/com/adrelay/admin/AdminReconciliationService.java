package com.adrelay.admin;

import com.adrelay.campaign.CampaignFulfillment;
import com.adrelay.domain.AuditEntry;
import com.adrelay.domain.AuditEntryRepository;
import com.adrelay.domain.Campaign;
import com.adrelay.domain.ObservedTransaction;
import com.adrelay.domain.ObservedTransactionRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderStatus;
import com.adrelay.domain.ReconciliationOutcome;
import com.adrelay.order.OrderLedgerService;
import com.adrelay.reconciliation.ReconciliationSettlement;
import com.adrelay.reconciliation.SettlementConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Audited manual corrections. Uses the same conditional updates and settlement unit as automatic matching;
 * every call, accepted or rejected, leaves an entry in admin_audit_log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminReconciliationService {

    static final String FORCE_MATCH = "FORCE_MATCH";
    static final String RECLASSIFY = "RECLASSIFY";
    static final String RETRY_PROVISIONING = "RETRY_PROVISIONING";
    static final String RESULT_OK = "OK";

    private final ObservedTransactionRepository observedTransactionRepository;
    private final OrderLedgerService orderLedgerService;
    private final ReconciliationSettlement settlement;
    private final CampaignFulfillment campaignFulfillment;
    private final AuditEntryRepository auditEntryRepository;
    private final Clock clock;

    /**
     * Processed transactions still awaiting a decision, newest first.
     */
    public List<ObservedTransaction> listUnresolved() {
        return observedTransactionRepository.findByProcessedTrueAndOutcomeInOrderByObservedAtDesc(
                ReconciliationOutcome.UNRESOLVED);
    }

    /**
     * Matches an unresolved transaction with a PENDING, unexpired order, then provisions and confirms.
     *
     * @throws AdminActionException TRANSACTION_NOT_FOUND, ORDER_NOT_FOUND, INVALID_STATE
     */
    public Campaign forceMatch(String txId, String orderId, String actor, String reason) {
        return audited(FORCE_MATCH, actor, reason, txId, orderId, () -> {
            ObservedTransaction tx = observedTransactionRepository.findByTxId(txId)
                    .orElseThrow(() -> new AdminActionException(AdminActionException.TRANSACTION_NOT_FOUND,
                            "Transaction not found: " + txId));
            if (!tx.isProcessed() || !ReconciliationOutcome.UNRESOLVED.contains(tx.getOutcome())) {
                throw new AdminActionException(AdminActionException.INVALID_STATE,
                        "Transaction " + txId + " is " + (tx.isProcessed() ? tx.getOutcome() : "unprocessed"));
            }
            Order order = orderLedgerService.findById(orderId)
                    .orElseThrow(() -> new AdminActionException(AdminActionException.ORDER_NOT_FOUND,
                            "Order not found: " + orderId));
            if (order.getStatus() != OrderStatus.PENDING) {
                throw new AdminActionException(AdminActionException.INVALID_STATE,
                        "Order " + orderId + " is " + order.getStatus());
            }
            Optional<Order> matched;
            try {
                matched = settlement.settleManually(txId, orderId, noteOf(actor, reason), clock.instant());
            } catch (SettlementConflictException e) {
                throw new AdminActionException(AdminActionException.INVALID_STATE, e.getMessage());
            }
            Order matchedOrder = matched.orElseThrow(() -> new AdminActionException(AdminActionException.INVALID_STATE,
                    "Order " + orderId + " is no longer pending or has expired"));
            log.info("Transaction {} force-matched to order {} by {}", txId, orderId, actor);
            return campaignFulfillment.fulfill(matchedOrder);
        });
    }

    /**
     * Closes an unresolved transaction as REFUNDED or RESOLVED_MANUALLY, provided its outcome is still
     * expectedOutcome.
     *
     * @throws AdminActionException TRANSACTION_NOT_FOUND, INVALID_OUTCOME, INVALID_STATE
     */
    public ObservedTransaction reclassify(String txId, ReconciliationOutcome expectedOutcome,
                                          ReconciliationOutcome newOutcome, String actor, String reason) {
        return audited(RECLASSIFY, actor, reason, txId, null, () -> {
            if (newOutcome == null || !ReconciliationOutcome.RESOLUTIONS.contains(newOutcome)) {
                throw new AdminActionException(AdminActionException.INVALID_OUTCOME,
                        "Target outcome must be one of " + ReconciliationOutcome.RESOLUTIONS);
            }
            if (expectedOutcome == null || !ReconciliationOutcome.UNRESOLVED.contains(expectedOutcome)) {
                throw new AdminActionException(AdminActionException.INVALID_OUTCOME,
                        "Expected outcome must be one of " + ReconciliationOutcome.UNRESOLVED);
            }
            ObservedTransaction tx = observedTransactionRepository.findByTxId(txId)
                    .orElseThrow(() -> new AdminActionException(AdminActionException.TRANSACTION_NOT_FOUND,
                            "Transaction not found: " + txId));
            ObservedTransaction changed = observedTransactionRepository.changeOutcome(txId, EnumSet.of(expectedOutcome),
                            newOutcome, null, noteOf(actor, reason), clock.instant())
                    .orElseThrow(() -> new AdminActionException(AdminActionException.INVALID_STATE,
                            "Transaction " + txId + " is " + tx.getOutcome() + ", expected " + expectedOutcome));
            log.info("Transaction {} reclassified {} -> {} by {}", txId, expectedOutcome, newOutcome, actor);
            return changed;
        });
    }

    /**
     * Provisions (if needed) and confirms (if not yet confirmed) a MATCHED order.
     *
     * @throws AdminActionException ORDER_NOT_FOUND, INVALID_STATE
     */
    public Campaign retryProvisioning(String orderId, String actor) {
        return audited(RETRY_PROVISIONING, actor, null, null, orderId, () -> {
            Order order = orderLedgerService.findById(orderId)
                    .orElseThrow(() -> new AdminActionException(AdminActionException.ORDER_NOT_FOUND,
                            "Order not found: " + orderId));
            if (order.getStatus() != OrderStatus.MATCHED) {
                throw new AdminActionException(AdminActionException.INVALID_STATE,
                        "Order " + orderId + " is " + order.getStatus() + ", not MATCHED");
            }
            return campaignFulfillment.fulfill(order);
        });
    }

    private <T> T audited(String action, String actor, String reason, String txId, String orderId, Supplier<T> body) {
        AuditEntry entry = new AuditEntry();
        entry.setAction(action);
        entry.setActor(actor);
        entry.setReason(reason);
        entry.setTxId(txId);
        entry.setOrderId(orderId);
        try {
            T result = body.get();
            if (result instanceof Campaign campaign) {
                entry.setCampaignId(campaign.getId());
                entry.setOrderId(campaign.getOrderId());
            }
            entry.setResult(RESULT_OK);
            return result;
        } catch (AdminActionException e) {
            entry.setResult(e.getErrorCode());
            log.info("{} by {} rejected: {}", action, actor, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            entry.setResult("ERROR");
            throw e;
        } finally {
            entry.setCreatedAt(Instant.now(clock));
            auditEntryRepository.save(entry);
        }
    }

    private static String noteOf(String actor, String reason) {
        return reason == null || reason.isBlank() ? "by " + actor : "by " + actor + ": " + reason;
    }
}

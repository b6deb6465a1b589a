package com.adrelay.ingestion.poller;

import com.adrelay.common.RetryPolicy;
import com.adrelay.domain.ObservedTransaction;
import com.adrelay.domain.ObservedTransactionRepository;
import com.adrelay.domain.PollCursor;
import com.adrelay.domain.PollCursorRepository;
import com.adrelay.ingestion.adapter.LedgerException;
import com.adrelay.ingestion.adapter.LedgerPosition;
import com.adrelay.ingestion.adapter.LedgerTransfer;
import com.adrelay.ingestion.adapter.TransferBatch;
import com.adrelay.ingestion.adapter.TransferSource;
import com.adrelay.ingestion.config.IngestionProperties;
import com.adrelay.reconciliation.ReconciliationMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One poll cycle for one receiving address: read transfers since the cursor (minus an overlap window), hand each
 * off as an observed transaction, advance the cursor to the last hand-off, then reconcile. A window the page
 * limit cut short is not advanced past; it is continued from its oldest read transaction next cycle, and the
 * cursor moves once it has been read back to its start. A failed read leaves the cursor position alone and
 * schedules the next attempt with capped exponential backoff.
 */
@Component
@Slf4j
public class PaymentPoller {

    private final TransferSource transferSource;
    private final PollCursorRepository pollCursorRepository;
    private final ObservedTransactionRepository observedTransactionRepository;
    private final ReconciliationMatcher reconciliationMatcher;
    private final IngestionProperties properties;
    private final Clock clock;
    private final RetryPolicy failureBackoff;

    public PaymentPoller(
            TransferSource transferSource,
            PollCursorRepository pollCursorRepository,
            ObservedTransactionRepository observedTransactionRepository,
            ReconciliationMatcher reconciliationMatcher,
            IngestionProperties properties,
            Clock clock
    ) {
        this.transferSource = transferSource;
        this.pollCursorRepository = pollCursorRepository;
        this.observedTransactionRepository = observedTransactionRepository;
        this.reconciliationMatcher = reconciliationMatcher;
        this.properties = properties;
        this.clock = clock;
        long baseMs = Math.max(1L, properties.getPollIntervalSeconds()) * 1000L;
        long capMs = Math.max(baseMs, properties.getMaxBackoffSeconds() * 1000L);
        this.failureBackoff = new RetryPolicy(baseMs, 0.0, Integer.MAX_VALUE, capMs);
    }

    public PollCycleResult pollOnce(String receivingAddress) {
        Instant now = clock.instant();
        PollCursor cursor = pollCursorRepository.ensureCursor(receivingAddress, now);
        if (cursor.getNextAttemptAfter() != null && now.isBefore(cursor.getNextAttemptAfter())) {
            log.debug("Poll of {} backing off until {}", receivingAddress, cursor.getNextAttemptAfter());
            return PollCycleResult.backingOff(receivingAddress);
        }
        PollCursor.ResumePoint resume = cursor.getResumePoint();
        Instant since;
        LedgerPosition startAfter = null;
        if (resume != null) {
            since = resume.getUntil();
            startAfter = new LedgerPosition(resume.getAfterLogicalTime(), resume.getAfterHash());
        } else if (cursor.getLastSeenAt() == null) {
            since = now.minusSeconds(properties.getInitialLookbackSeconds());
        } else {
            since = cursor.getLastSeenAt().minusSeconds(properties.getLookbackSeconds());
        }

        TransferBatch batch;
        try {
            batch = transferSource.fetchSince(receivingAddress, since, startAfter);
        } catch (LedgerException e) {
            recordFailure(cursor, e, now);
            return new PollCycleResult(receivingAddress, PollCycleResult.Status.FAILED, 0, 0, 0);
        }
        List<LedgerTransfer> transfers = batch.transfers();

        LedgerTransfer lastHandedOff = null;
        int handedOff = 0;
        int inserted = 0;
        DataAccessException handOffFailure = null;
        for (LedgerTransfer transfer : transfers) {
            try {
                if (observedTransactionRepository.insertIfAbsent(toObserved(transfer, receivingAddress, now))) {
                    inserted++;
                }
            } catch (DataAccessException e) {
                handOffFailure = e;
                break;
            }
            lastHandedOff = transfer;
            handedOff++;
        }
        if (handOffFailure != null) {
            // transfers are ascending, so only a fully read fresh window may move past the ones stored
            if (resume == null && batch.complete() && lastHandedOff != null) {
                pollCursorRepository.advance(receivingAddress, lastHandedOff.timestamp(), lastHandedOff.txId(),
                        lastHandedOff.logicalTime(), now);
            }
            recordFailure(cursor, handOffFailure, now);
            return new PollCycleResult(receivingAddress, PollCycleResult.Status.FAILED, transfers.size(), handedOff, inserted);
        }
        if (!batch.complete()) {
            pollCursorRepository.saveResumePoint(receivingAddress, nextResumePoint(resume, since, batch), now);
        } else if (resume != null) {
            if (resume.getHeadAt() != null) {
                pollCursorRepository.advance(receivingAddress, resume.getHeadAt(), resume.getHeadTxId(),
                        resume.getHeadLogicalTime(), now);
            }
            pollCursorRepository.clearResumePoint(receivingAddress, now);
            log.info("Poll of {} finished reading back to {}", receivingAddress, since);
        } else if (lastHandedOff != null) {
            pollCursorRepository.advance(receivingAddress, lastHandedOff.timestamp(), lastHandedOff.txId(),
                    lastHandedOff.logicalTime(), now);
        }
        if (cursor.getConsecutiveFailures() > 0 || cursor.getNextAttemptAfter() != null) {
            log.info("Poll of {} recovered after {} failure(s)", receivingAddress, cursor.getConsecutiveFailures());
        }
        pollCursorRepository.recordSuccess(receivingAddress, now);
        if (inserted > 0) {
            log.info("Poll of {}: {} transfer(s) read, {} new", receivingAddress, transfers.size(), inserted);
        }

        try {
            reconciliationMatcher.reconcileAddress(receivingAddress);
        } catch (RuntimeException e) {
            log.error("Reconciliation after poll of {} failed; the sweep will retry", receivingAddress, e);
        }
        PollCycleResult.Status status = batch.complete() ? PollCycleResult.Status.COMPLETED : PollCycleResult.Status.PARTIAL;
        return new PollCycleResult(receivingAddress, status, transfers.size(), handedOff, inserted);
    }

    /**
     * Delay before the next attempt after the n-th consecutive failure (n >= 1): min(cap, interval * 2^(n-1)).
     */
    public long backoffMs(int consecutiveFailures) {
        return failureBackoff.delayMs(Math.max(0, consecutiveFailures - 1));
    }

    private void recordFailure(PollCursor cursor, RuntimeException cause, Instant now) {
        int failures = cursor.getConsecutiveFailures() + 1;
        Instant nextAttempt = now.plusMillis(backoffMs(failures));
        pollCursorRepository.recordFailure(cursor.getReceivingAddress(), failures, nextAttempt, cause.getMessage(), now);
        log.warn("Poll of {} failed ({} in a row), next attempt after {}: {}",
                cursor.getReceivingAddress(), failures, nextAttempt, cause.getMessage());
    }

    /**
     * The window start and head stay those of the first unfinished read; only the continuation moves back.
     */
    private static PollCursor.ResumePoint nextResumePoint(PollCursor.ResumePoint current, Instant since,
                                                          TransferBatch batch) {
        PollCursor.ResumePoint next = new PollCursor.ResumePoint();
        next.setAfterLogicalTime(batch.resumeAfter().logicalTime());
        next.setAfterHash(batch.resumeAfter().hash());
        if (current != null) {
            next.setUntil(current.getUntil());
            next.setHeadAt(current.getHeadAt());
            next.setHeadTxId(current.getHeadTxId());
            next.setHeadLogicalTime(current.getHeadLogicalTime());
            return next;
        }
        next.setUntil(since);
        List<LedgerTransfer> transfers = batch.transfers();
        if (!transfers.isEmpty()) {
            LedgerTransfer newest = transfers.get(transfers.size() - 1);
            next.setHeadAt(newest.timestamp());
            next.setHeadTxId(newest.txId());
            next.setHeadLogicalTime(newest.logicalTime());
        } else {
            next.setHeadAt(batch.newestReadAt());
        }
        return next;
    }

    private static ObservedTransaction toObserved(LedgerTransfer transfer, String receivingAddress, Instant now) {
        ObservedTransaction tx = new ObservedTransaction();
        tx.setTxId(transfer.txId());
        tx.setReceivingAddress(receivingAddress);
        tx.setFromAddress(transfer.fromAddress());
        tx.setToAddress(transfer.toAddress());
        tx.setAmount(transfer.amount());
        tx.setMemo(transfer.memo());
        tx.setLogicalTime(transfer.logicalTime());
        tx.setObservedAt(transfer.timestamp());
        tx.setFetchedAt(now);
        tx.setProcessed(false);
        return tx;
    }
}

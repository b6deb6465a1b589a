package com.adrelay.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic pass over unprocessed observed transactions of all addresses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSweepJob {

    private final ReconciliationMatcher reconciliationMatcher;

    @Scheduled(
            fixedDelayString = "${adrelay.reconciliation.sweep-interval-seconds:60}",
            initialDelayString = "${adrelay.reconciliation.sweep-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS)
    public void runScheduled() {
        int processed = reconciliationMatcher.reconcilePending();
        if (processed > 0) {
            log.info("Reconciliation sweep processed {} transaction(s)", processed);
        }
    }
}

package com.adrelay.order;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic PENDING -> EXPIRED sweep.
 */
@Component
@RequiredArgsConstructor
public class OrderExpiryJob {

    private final OrderLedgerService orderLedgerService;

    @Scheduled(
            fixedDelayString = "${adrelay.order.expiry-sweep-interval-seconds:60}",
            initialDelayString = "${adrelay.order.expiry-sweep-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS)
    public void runScheduled() {
        orderLedgerService.expireStale();
    }
}

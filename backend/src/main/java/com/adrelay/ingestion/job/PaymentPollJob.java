package com.adrelay.ingestion.job;

import com.adrelay.config.AsyncConfig;
import com.adrelay.ingestion.poller.PaymentPoller;
import com.adrelay.order.config.OrderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Poll tick: submits one cycle per receiving address to the poller executor. An address whose previous cycle
 * is still running is skipped, so each address has at most one poller at a time.
 */
@Component
@ConditionalOnProperty(prefix = "adrelay.ingestion", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PaymentPollJob {

    private final PaymentPoller paymentPoller;
    private final OrderProperties orderProperties;
    private final Executor pollerExecutor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public PaymentPollJob(
            PaymentPoller paymentPoller,
            OrderProperties orderProperties,
            @Qualifier(AsyncConfig.POLLER_EXECUTOR) Executor pollerExecutor
    ) {
        this.paymentPoller = paymentPoller;
        this.orderProperties = orderProperties;
        this.pollerExecutor = pollerExecutor;
    }

    @Scheduled(
            fixedDelayString = "${adrelay.ingestion.poll-interval-seconds:30}",
            initialDelayString = "${adrelay.ingestion.initial-delay-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void runScheduled() {
        for (String address : orderProperties.getReceivingAddresses()) {
            submit(address);
        }
    }

    /**
     * @return false when a cycle for the address is already running or the executor is saturated
     */
    boolean submit(String receivingAddress) {
        if (!inFlight.add(receivingAddress)) {
            log.debug("Poll of {} still running; tick skipped", receivingAddress);
            return false;
        }
        try {
            pollerExecutor.execute(() -> {
                try {
                    paymentPoller.pollOnce(receivingAddress);
                } catch (RuntimeException e) {
                    log.error("Poll cycle for {} aborted", receivingAddress, e);
                } finally {
                    inFlight.remove(receivingAddress);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(receivingAddress);
            log.warn("Poller executor saturated; {} skipped this tick", receivingAddress);
            return false;
        }
    }
}

package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.Order;
import com.adrelay.notification.ConfirmationDispatcher;
import com.adrelay.order.OrderLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Repairs interrupted fulfilment: provisions MATCHED orders that have no campaign and emits confirmations
 * that were never claimed, however old the match. Recent matches are left to the matcher that is still working
 * on them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProvisioningRetryJob {

    static final Duration GRACE = Duration.ofMinutes(1);

    private final OrderLedgerService orderLedgerService;
    private final CampaignFulfillment campaignFulfillment;
    private final CampaignRepository campaignRepository;
    private final ConfirmationDispatcher confirmationDispatcher;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${adrelay.campaign.provisioning-retry-interval-seconds:120}",
            initialDelayString = "${adrelay.campaign.provisioning-retry-interval-seconds:120}",
            timeUnit = TimeUnit.SECONDS)
    public void runScheduled() {
        retryOnce();
    }

    /**
     * @return number of orders provisioned plus confirmations emitted
     */
    public int retryOnce() {
        Instant now = clock.instant();
        int repaired = 0;
        for (Order order : orderLedgerService.findMatchedWithoutCampaign(now.minus(GRACE))) {
            try {
                Campaign campaign = campaignFulfillment.fulfill(order);
                log.info("Provisioning retry created campaign {} for order {}", campaign.getId(), order.getId());
                repaired++;
            } catch (RuntimeException e) {
                log.error("Provisioning retry failed for order {}", order.getId(), e);
            }
        }
        for (Campaign campaign : campaignRepository.findByConfirmationEmittedAtIsNullAndCreatedAtBefore(now.minus(GRACE))) {
            try {
                if (confirmationDispatcher.emitOnce(campaign)) {
                    repaired++;
                }
            } catch (RuntimeException e) {
                log.error("Confirmation retry failed for campaign {}", campaign.getId(), e);
            }
        }
        return repaired;
    }
}

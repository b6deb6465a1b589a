package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.Order;
import com.adrelay.notification.ConfirmationDispatcher;
import com.adrelay.order.OrderLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Post-match steps: provision, mark the order provisioned, then confirm once. Safe to repeat for the same order.
 */
@Service
@RequiredArgsConstructor
public class CampaignFulfillment {

    private final CampaignProvisioner campaignProvisioner;
    private final ConfirmationDispatcher confirmationDispatcher;
    private final OrderLedgerService orderLedgerService;

    public Campaign fulfill(Order order) {
        Campaign campaign = campaignProvisioner.provision(order);
        orderLedgerService.markProvisioned(order.getId());
        confirmationDispatcher.emitOnce(campaign);
        return campaign;
    }
}

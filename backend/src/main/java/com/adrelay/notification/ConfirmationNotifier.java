package com.adrelay.notification;

import com.adrelay.domain.CampaignProvisionedEvent;

/**
 * Outbound seam to the messaging collaborator. Invoked at most once per campaign; delivery is not guaranteed.
 */
public interface ConfirmationNotifier {

    void emitConfirmation(String userId, CampaignProvisionedEvent event);
}

package com.adrelay.notification;

import com.adrelay.domain.CampaignProvisionedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes confirmations on the application event bus; the messaging collaborator listens for
 * {@link CampaignProvisionedEvent}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApplicationEventConfirmationNotifier implements ConfirmationNotifier {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void emitConfirmation(String userId, CampaignProvisionedEvent event) {
        applicationEventPublisher.publishEvent(event);
        log.info("Confirmation emitted for campaign {} (user {})", event.campaignId(), userId);
    }
}

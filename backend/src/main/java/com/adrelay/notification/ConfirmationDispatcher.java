package com.adrelay.notification;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignProvisionedEvent;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.pricing.PricingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Single-invocation confirmation: confirmationEmittedAt is claimed with a conditional update and only the
 * claiming caller invokes the notifier. A notifier failure after the claim is logged, not retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfirmationDispatcher {

    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final CampaignRepository campaignRepository;
    private final ConfirmationNotifier confirmationNotifier;
    private final Clock clock;

    /**
     * @return true when this call claimed and invoked the notifier
     */
    public boolean emitOnce(Campaign campaign) {
        if (!campaignRepository.markConfirmationEmitted(campaign.getId(), clock.instant())) {
            log.debug("Confirmation for campaign {} already emitted", campaign.getId());
            return false;
        }
        CampaignProvisionedEvent event = new CampaignProvisionedEvent(
                campaign.getUserId(),
                campaign.getId(),
                campaign.getChannelIds() == null ? 0 : campaign.getChannelIds().size(),
                campaign.getTotalPosts(),
                scheduleSummary(campaign));
        try {
            confirmationNotifier.emitConfirmation(campaign.getUserId(), event);
        } catch (RuntimeException e) {
            log.error("Confirmation notifier failed for campaign {}; not retried", campaign.getId(), e);
        }
        return true;
    }

    /**
     * Machine-readable cadence, e.g. "7d x 3/day x 2ch @ 00:00,08:00,16:00".
     */
    static String scheduleSummary(Campaign campaign) {
        List<LocalTime> slotTimes = PricingEngine.scheduleTimes(campaign.getPostsPerDay());
        int channels = campaign.getChannelIds() == null ? 0 : campaign.getChannelIds().size();
        String times = slotTimes.stream().map(SLOT_FORMAT::format).collect(Collectors.joining(","));
        return campaign.getDurationDays() + "d x " + campaign.getPostsPerDay() + "/day x " + channels + "ch @ " + times;
    }
}

package com.adrelay.domain;

import java.time.Instant;

public interface CampaignRepositoryCustom {

    /**
     * Sets confirmationEmittedAt if it is still null. True only for the caller that set it.
     */
    boolean markConfirmationEmitted(String campaignId, Instant now);
}

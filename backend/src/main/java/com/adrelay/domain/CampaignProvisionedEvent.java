package com.adrelay.domain;

/**
 * Structured confirmation for the messaging collaborator, emitted once per provisioned campaign.
 * Contains no presentation text; scheduleSummary is machine-readable (e.g. "7d x 3/day @ 00:00,08:00,16:00").
 */
public record CampaignProvisionedEvent(String userId, String campaignId, int channelCount, int totalPosts,
                                       String scheduleSummary) {
}

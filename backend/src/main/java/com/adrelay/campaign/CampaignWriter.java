package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.ScheduledPost;
import com.adrelay.domain.ScheduledPostRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes a campaign and all of its posts in one Mongo transaction: either every row exists or none does.
 */
@Component
@RequiredArgsConstructor
public class CampaignWriter {

    private final CampaignRepository campaignRepository;
    private final ScheduledPostRepository scheduledPostRepository;

    @Transactional
    public Campaign write(Campaign campaign, List<ScheduledPost> posts) {
        Campaign saved = campaignRepository.insert(campaign);
        scheduledPostRepository.insert(posts);
        return saved;
    }
}

package com.adrelay.campaign;

import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderStatus;
import com.adrelay.domain.ScheduledPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Turns a MATCHED order into its campaign. Idempotent: an existing campaign is returned unchanged, and a writer
 * that loses the unique orderId race returns the winner's campaign.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignProvisioner {

    private final CampaignRepository campaignRepository;
    private final CampaignWriter campaignWriter;
    private final Clock clock;

    /**
     * @throws CampaignProvisioningException ORDER_NOT_MATCHED when the order is not MATCHED
     */
    public Campaign provision(Order order) {
        if (order.getStatus() != OrderStatus.MATCHED || order.getMatchedAt() == null) {
            throw new CampaignProvisioningException(CampaignProvisioningException.ORDER_NOT_MATCHED,
                    "Order " + order.getId() + " is " + order.getStatus() + ", not MATCHED");
        }
        Optional<Campaign> existing = campaignRepository.findByOrderId(order.getId());
        if (existing.isPresent()) {
            log.debug("Campaign {} already provisioned for order {}", existing.get().getId(), order.getId());
            return existing.get();
        }
        Instant now = clock.instant();
        Campaign campaign = newCampaign(order, now);
        List<ScheduledPost> posts = ScheduleBuilder.build(campaign, now);
        try {
            Campaign saved = campaignWriter.write(campaign, posts);
            log.info("Campaign {} provisioned for order {}: {} posts over {} day(s) in {} channel(s)",
                    saved.getId(), order.getId(), posts.size(), order.getDurationDays(), order.getChannelIds().size());
            return saved;
        } catch (DataAccessException e) {
            return campaignRepository.findByOrderId(order.getId())
                    .map(winner -> {
                        log.info("Order {} provisioned concurrently; using campaign {}", order.getId(), winner.getId());
                        return winner;
                    })
                    .orElseThrow(() -> e);
        }
    }

    private static Campaign newCampaign(Order order, Instant now) {
        Campaign campaign = new Campaign();
        campaign.setId(new ObjectId().toHexString());
        campaign.setOrderId(order.getId());
        campaign.setUserId(order.getUserId());
        campaign.setReferenceCode(order.getReferenceCode());
        campaign.setChannelIds(List.copyOf(order.getChannelIds()));
        campaign.setDurationDays(order.getDurationDays());
        campaign.setPostsPerDay(order.getPostsPerDay());
        campaign.setTotalPosts(order.getDurationDays() * order.getPostsPerDay() * order.getChannelIds().size());
        campaign.setStartsAt(order.getMatchedAt());
        campaign.setCreatedAt(now);
        return campaign;
    }
}

package com.adrelay.api.controller;

import com.adrelay.api.dto.CampaignResponse;
import com.adrelay.api.dto.ScheduledPostResponse;
import com.adrelay.campaign.ScheduledPostService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /campaigns/by-order/{orderId}, GET /campaigns/{id}/posts.
 */
@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final ScheduledPostService scheduledPostService;

    @GetMapping("/by-order/{orderId}")
    public ResponseEntity<CampaignResponse> getByOrder(@PathVariable String orderId) {
        return scheduledPostService.findCampaignByOrderId(orderId)
                .map(c -> ResponseEntity.ok(CampaignResponse.from(c)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{campaignId}/posts")
    public ResponseEntity<List<ScheduledPostResponse>> getPosts(@PathVariable String campaignId) {
        if (scheduledPostService.findCampaign(campaignId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<ScheduledPostResponse> posts = scheduledPostService.findByCampaign(campaignId).stream()
                .map(ScheduledPostResponse::from)
                .toList();
        return ResponseEntity.ok(posts);
    }
}

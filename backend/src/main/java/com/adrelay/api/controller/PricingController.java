package com.adrelay.api.controller;

import com.adrelay.api.dto.PricingQuoteResponse;
import com.adrelay.pricing.PricingQuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /pricing/quote?durationDays&channelCount.
 */
@RestController
@RequestMapping("/api/v1/pricing")
@RequiredArgsConstructor
public class PricingController {

    private final PricingQuoteService pricingQuoteService;

    @GetMapping("/quote")
    public ResponseEntity<PricingQuoteResponse> quote(@RequestParam int durationDays,
                                                      @RequestParam(defaultValue = "1") int channelCount) {
        return ResponseEntity.ok(PricingQuoteResponse.from(pricingQuoteService.quote(durationDays, channelCount)));
    }
}

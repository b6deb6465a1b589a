package com.adrelay.pricing;

import com.adrelay.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Cached quotes for the public quote endpoint. Rejected inputs are not cached.
 */
@Service
@RequiredArgsConstructor
public class PricingQuoteService {

    private final PricingEngine pricingEngine;

    @Cacheable(cacheNames = CaffeineConfig.PRICING_QUOTE_CACHE, key = "#durationDays + ':' + #channelCount")
    public PricingQuote quote(int durationDays, int channelCount) {
        return pricingEngine.quote(durationDays, channelCount);
    }
}

package com.adrelay.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Quotes are pure functions of (duration, channel count) and the
 * configured rates, so they only expire to pick up a configuration reload.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PRICING_QUOTE_CACHE = "pricingQuoteCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PRICING_QUOTE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}

package com.adrelay.ingestion.config;

import com.adrelay.common.RetryPolicy;
import com.adrelay.ingestion.adapter.LedgerClient;
import com.adrelay.ingestion.adapter.LedgerEndpointRotator;
import com.adrelay.ingestion.adapter.TonApiClient;
import com.adrelay.ingestion.adapter.WebClientLedgerClient;
import com.adrelay.ingestion.adapter.WebClientTonApiClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Ledger API wiring per provider (TON Center, tonapi.io fallback): endpoint rotator with request retry policy,
 * local rate limiter, WebClient-based client.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionAdapterConfig {

    @Bean(name = "ledgerEndpointRotator")
    public LedgerEndpointRotator ledgerEndpointRotator(IngestionProperties properties) {
        return rotator(properties.getEndpoints(), properties.getRetry());
    }

    @Bean(name = "tonApiEndpointRotator")
    public LedgerEndpointRotator tonApiEndpointRotator(IngestionProperties properties) {
        return rotator(properties.getTonapi().getEndpoints(), properties.getRetry());
    }

    @Bean(name = "ledgerRateLimiter")
    public RateLimiter ledgerRateLimiter(IngestionProperties properties) {
        return rateLimiter("ledger-api", properties.getMaxRequestsPerSecond(), properties.getLimiterTimeoutMs());
    }

    @Bean(name = "tonApiRateLimiter")
    public RateLimiter tonApiRateLimiter(IngestionProperties properties) {
        return rateLimiter("tonapi", properties.getTonapi().getMaxRequestsPerSecond(), properties.getLimiterTimeoutMs());
    }

    @Bean
    public LedgerClient ledgerClient(WebClient.Builder webClientBuilder, IngestionProperties properties) {
        return new WebClientLedgerClient(webClientBuilder,
                Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())), properties.getApiKey());
    }

    @Bean
    public TonApiClient tonApiClient(WebClient.Builder webClientBuilder, IngestionProperties properties) {
        return new WebClientTonApiClient(webClientBuilder,
                Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())), properties.getTonapi().getApiKey());
    }

    private static LedgerEndpointRotator rotator(List<String> endpoints, IngestionProperties.Retry retry) {
        RetryPolicy policy = new RetryPolicy(
                retry.getBaseDelayMs(),
                retry.getJitterFactor(),
                retry.getMaxAttempts(),
                Math.max(retry.getBaseDelayMs(), retry.getMaxDelayMs()));
        return new LedgerEndpointRotator(endpoints, policy);
    }

    private static RateLimiter rateLimiter(String name, int perSecond, long timeoutMs) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, perSecond))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, timeoutMs)))
                .build();
        return RateLimiter.of(name, config);
    }
}

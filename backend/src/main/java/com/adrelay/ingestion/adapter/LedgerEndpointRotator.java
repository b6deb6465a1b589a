package com.adrelay.ingestion.adapter;

import com.adrelay.common.RetryPolicy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin ledger endpoint selection. Endpoints that failed recently are cooled down and skipped
 * while another endpoint is available. Retry delays come from the wrapped RetryPolicy.
 */
public class LedgerEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger();
    private final RetryPolicy retryPolicy;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public LedgerEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger endpoint required");
        }
        this.endpoints = endpoints.stream().map(LedgerEndpointRotator::trimTrailingSlash).toList();
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    /**
     * Next endpoint not cooling down at nowMs; when all are cooling down, the next one in order.
     */
    public String nextEndpoint(long nowMs) {
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            Long until = cooldownUntilMs.get(endpoint);
            if (until == null || until <= nowMs) {
                return endpoint;
            }
        }
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    public void coolDown(String endpoint, long untilMs) {
        cooldownUntilMs.merge(endpoint, untilMs, Math::max);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return Math.max(1, retryPolicy.getMaxAttempts());
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

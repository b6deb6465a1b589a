package com.adrelay.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Payment poller and ledger API client. Documented in application.yml under adrelay.ingestion.
 * Receiving addresses are configured under adrelay.order.receiving-addresses.
 */
@ConfigurationProperties(prefix = "adrelay.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** Turns the scheduled poll off (tests, maintenance). Default true. */
    private boolean enabled = true;

    /** Seconds between poll ticks; also the base of the failure backoff. Default 30. */
    private long pollIntervalSeconds = 30L;

    /** Overlap re-read behind the cursor so late-indexed transfers are not missed. Default 600 (10 min). */
    private long lookbackSeconds = 600L;

    /** How far back the first cycle of a new address reads. Default 3600 (1 h). */
    private long initialLookbackSeconds = 3600L;

    /** Transactions per ledger API page. Default 50. */
    private int pageSize = 50;

    /** Pages read backwards per cycle before stopping. Default 5. */
    private int maxPagesPerCycle = 5;

    /** Decimal places of the ledger's base unit (TON: 9, nanotons). */
    private int amountDecimals = 9;

    /** Upper bound of the per-address failure backoff. Default 600. */
    private long maxBackoffSeconds = 600L;

    /** Timeout of one ledger API request. Default 10000. */
    private long requestTimeoutMs = 10_000L;

    /** Local rate limit across all ledger API calls. Default 1 (TON Center without API key). */
    private int maxRequestsPerSecond = 1;

    /** Max wait for a rate limiter permit before the attempt fails. Default 5000. */
    private long limiterTimeoutMs = 5_000L;

    /** Optional TON Center API key, sent as X-API-Key. */
    private String apiKey;

    /** TON Center v2 compatible base URLs, rotated round-robin. */
    private List<String> endpoints = new ArrayList<>(List.of("https://toncenter.com/api/v2"));

    /** Per-request retry inside a cycle. */
    private Retry retry = new Retry();

    /** tonapi.io, read when every TON Center endpoint failed. */
    private TonApi tonapi = new TonApi();

    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
        private long baseDelayMs = 1000L;
        /** Jitter factor 0..1 (0.2 = ±20%). Default 0.2. */
        private double jitterFactor = 0.2;
        /** Attempts per request, first call included. Default 3. */
        private int maxAttempts = 3;
        /** Ceiling of a single retry delay. Default 30000. */
        private long maxDelayMs = 30_000L;
    }

    @Getter
    @Setter
    public static class TonApi {
        /** Fall back to tonapi.io when TON Center cannot be read. Default true. */
        private boolean enabled = true;
        /** tonapi v2 base URLs, rotated round-robin. */
        private List<String> endpoints = new ArrayList<>(List.of("https://tonapi.io/v2"));
        /** Optional tonapi bearer token. */
        private String apiKey;
        /** Local rate limit across all tonapi calls. Default 1 (no token). */
        private int maxRequestsPerSecond = 1;
    }
}

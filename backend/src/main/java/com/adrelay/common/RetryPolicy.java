package com.adrelay.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter and an upper bound. Used for ledger API request retries and for
 * spacing out failed poll cycles.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("0 <= baseDelayMs <= maxDelayMs required");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(maxDelay, baseDelay * 2^attempt), then jitter; never above maxDelay.
     */
    public long delayMs(int attempt) {
        int shift = Math.max(0, Math.min(attempt, 30));
        long exponential = baseDelayMs << shift;
        if (exponential < 0 || exponential > maxDelayMs) {
            exponential = maxDelayMs;
        }
        return Math.min(maxDelayMs, jitter(exponential));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, ±20% jitter, 3 attempts, 30s ceiling.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 3, 30_000L);
    }
}

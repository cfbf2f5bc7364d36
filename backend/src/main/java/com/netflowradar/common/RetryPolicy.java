package com.netflowradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with ±jitter, capped at maxDelayMs. Used for HTTP RPC retries and subscription reconnects.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final long maxDelayMs;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, long maxDelayMs, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Bound for request-level retries. Subscription reconnects ignore it. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, ±20% jitter, 60s cap, 5 max attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 60_000L, 5);
    }
}

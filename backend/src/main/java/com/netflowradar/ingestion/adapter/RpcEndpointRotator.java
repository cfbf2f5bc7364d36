package com.netflowradar.ingestion.adapter;

import com.netflowradar.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the configured HTTP JSON-RPC endpoints used for chain head lookups, one per attempt,
 * and supplies the backoff between attempts.
 */
public class RpcEndpointRotator {

    private final List<String> httpUrls;
    private final AtomicInteger cursor = new AtomicInteger();
    private final RetryPolicy retryPolicy;

    /**
     * @param retryPolicy null falls back to {@link RetryPolicy#defaultPolicy()}
     */
    public RpcEndpointRotator(List<String> httpUrls, RetryPolicy retryPolicy) {
        if (httpUrls == null || httpUrls.isEmpty()) {
            throw new IllegalArgumentException("At least one HTTP RPC endpoint required");
        }
        this.httpUrls = List.copyOf(httpUrls);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        return httpUrls.get(Math.floorMod(cursor.getAndIncrement(), httpUrls.size()));
    }

    /** Backoff before the attempt following {@code attempt} (0-based). */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }
}

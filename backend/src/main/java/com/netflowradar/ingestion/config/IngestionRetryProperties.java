package com.netflowradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for subscription reconnects and HTTP RPC retries (exponential ± jitter).
 */
@ConfigurationProperties(prefix = "netflowradar.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Upper bound for a single backoff delay. */
    private long maxDelayMs = 60_000L;

    /** Max attempts for a single HTTP RPC call. Reconnects are not bounded. */
    private int maxAttempts = 5;
}

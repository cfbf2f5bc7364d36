package com.netflowradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local throttling of HTTP JSON-RPC calls.
 */
@ConfigurationProperties(prefix = "netflowradar.ingestion.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionEvmRpcProperties {

    private int maxRequestsPerSecond = 10;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Upper bound on a single HTTP JSON-RPC round trip. */
    private long requestTimeoutMs = 5_000;
}

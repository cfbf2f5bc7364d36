package com.netflowradar.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflowradar.common.HexQuantity;
import com.netflowradar.common.Sleeper;
import com.netflowradar.ingestion.adapter.RpcEndpointRotator;
import com.netflowradar.ingestion.adapter.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.OptionalLong;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the current chain head via eth_blockNumber over HTTP, rotating endpoints with backoff.
 * Disabled (always empty) when no HTTP endpoints are configured.
 */
@Slf4j
public class ChainHeadProbe {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Duration requestTimeout;

    /**
     * @param rotator null disables the probe
     * @param requestTimeout upper bound on a single eth_blockNumber round trip
     */
    public ChainHeadProbe(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                          ObjectMapper objectMapper, Sleeper sleeper, Duration requestTimeout) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.requestTimeout = requestTimeout;
    }

    public boolean isEnabled() {
        return rotator != null;
    }

    /**
     * @return head block number, or empty when the probe is disabled
     * @throws RpcException when every attempt failed
     */
    public OptionalLong currentBlock() {
        if (rotator == null) {
            return OptionalLong.empty();
        }
        RpcException last = null;
        for (int attempt = 0; attempt < Math.max(1, rotator.getMaxAttempts()); attempt++) {
            if (attempt > 0) {
                try {
                    sleeper.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during eth_blockNumber retry", e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return OptionalLong.of(fetch(endpoint));
            } catch (RpcException e) {
                log.debug("eth_blockNumber failed on {}: {}", endpoint, e.getMessage());
                last = e;
            }
        }
        throw new RpcException("eth_blockNumber failed after " + rotator.getMaxAttempts() + " attempts", last);
    }

    private long fetch(String endpoint) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before eth_blockNumber on " + endpoint);
        }
        String json = rpcClient.call(endpoint, "eth_blockNumber", Collections.emptyList())
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException("eth_blockNumber timed out after " + requestTimeout.toMillis() + " ms on " + endpoint, e))
                .block();
        if (json == null) {
            throw new RpcException("eth_blockNumber returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException("Failed to parse eth_blockNumber", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException("eth_blockNumber error: " + error);
        }
        Long head = HexQuantity.parseLongOrNull(root.path("result").asText(null));
        if (head == null) {
            throw new RpcException("eth_blockNumber invalid result: " + root.path("result"));
        }
        return head;
    }
}

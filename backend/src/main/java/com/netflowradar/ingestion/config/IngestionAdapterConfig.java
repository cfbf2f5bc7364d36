package com.netflowradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflowradar.common.ConfigurationException;
import com.netflowradar.common.RetryPolicy;
import com.netflowradar.common.Sleeper;
import com.netflowradar.ingestion.adapter.RpcEndpointRotator;
import com.netflowradar.ingestion.adapter.evm.ChainHeadProbe;
import com.netflowradar.ingestion.adapter.evm.EvmLogSubscriptionClient;
import com.netflowradar.ingestion.adapter.evm.EvmRpcClient;
import com.netflowradar.ingestion.adapter.evm.LogNotificationParser;
import com.netflowradar.ingestion.adapter.evm.WebClientEvmRpcClient;
import com.netflowradar.ingestion.adapter.evm.WebSocketEvmLogSubscriptionClient;
import com.netflowradar.ingestion.registry.ExchangeRegistry;
import com.netflowradar.ingestion.registry.MonitoredAddressSet;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;

/**
 * Wires the chain transports, the exchange registry and the retry policy from configuration.
 * Malformed configuration fails context startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, TokenProperties.class, ExchangeProperties.class,
        IngestionRetryProperties.class, IngestionEvmRpcProperties.class, SubscriberProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy ingestionRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public ExchangeRegistry exchangeRegistry(ExchangeProperties properties) {
        ExchangeRegistry registry = new ExchangeRegistry(properties.getExchanges());
        for (MonitoredAddressSet exchange : registry.exchanges()) {
            log.info("Loaded {} monitored addresses for {}", exchange.size(), exchange.label());
        }
        return registry;
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(IngestionEvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public ChainHeadProbe chainHeadProbe(ChainProperties chainProperties, EvmRpcClient evmRpcClient,
                                         RateLimiter evmRpcRateLimiter, RetryPolicy ingestionRetryPolicy,
                                         IngestionEvmRpcProperties evmRpcProperties,
                                         ObjectMapper objectMapper, Sleeper sleeper) {
        List<String> urls = chainProperties.getHttpUrls().stream()
                .filter(u -> u != null && !u.isBlank())
                .map(String::trim)
                .toList();
        RpcEndpointRotator rotator = urls.isEmpty() ? null : new RpcEndpointRotator(urls, ingestionRetryPolicy);
        if (rotator == null) {
            log.info("No HTTP RPC endpoints configured; chain head probe disabled");
        }
        Duration requestTimeout = Duration.ofMillis(Math.max(1L, evmRpcProperties.getRequestTimeoutMs()));
        return new ChainHeadProbe(evmRpcClient, rotator, evmRpcRateLimiter, objectMapper, sleeper, requestTimeout);
    }

    @Bean
    public EvmLogSubscriptionClient evmLogSubscriptionClient(ChainProperties chainProperties, ObjectMapper objectMapper) {
        URI endpoint;
        try {
            endpoint = new URI(chainProperties.getWsUrl().trim());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid netflowradar.chain.ws-url: " + chainProperties.getWsUrl(), e);
        }
        String scheme = endpoint.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new ConfigurationException("netflowradar.chain.ws-url must use ws or wss: " + endpoint);
        }
        return new WebSocketEvmLogSubscriptionClient(
                new ReactorNettyWebSocketClient(), endpoint, new LogNotificationParser(objectMapper));
    }
}

package com.netflowradar.ingestion.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflowradar.common.RetryPolicy;
import com.netflowradar.ingestion.adapter.RpcEndpointRotator;
import com.netflowradar.ingestion.adapter.RpcException;
import com.netflowradar.ingestion.adapter.evm.ChainHeadProbe;
import com.netflowradar.ingestion.adapter.evm.EvmLogSubscriptionClient;
import com.netflowradar.ingestion.adapter.evm.EvmRpcClient;
import com.netflowradar.ingestion.config.SubscriberProperties;
import com.netflowradar.ingestion.config.TokenProperties;
import com.netflowradar.ingestion.decoder.RawLog;
import com.netflowradar.ingestion.decoder.TransferDecoder;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the subscription loop on the calling thread (synchronous executor); stop() is called from within a
 * stubbed collaborator to end the loop.
 */
@ExtendWith(MockitoExtension.class)
class ChainLogSubscriberTest {

    private static final String CONTRACT = "0x0000000000000000000000000000000000001010";

    @Mock
    EvmLogSubscriptionClient client;
    @Mock
    TransferLogProcessor processor;
    @Mock
    ChainHeadProbe chainHeadProbe;

    private final List<Long> sleeps = new ArrayList<>();
    private IngestionStats stats;
    private ChainLogSubscriber subscriber;

    @BeforeEach
    void setUp() {
        TokenProperties token = new TokenProperties();
        token.setContractAddress(CONTRACT);
        stats = new IngestionStats(Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC));
        subscriber = new ChainLogSubscriber(client, processor, chainHeadProbe,
                new RetryPolicy(100L, 0, 10_000L, 5), sleeps::add, stats, token, new SubscriberProperties(), Runnable::run);
    }

    private static RawLog log(long block) {
        return new RawLog(CONTRACT, List.of(TransferDecoder.TRANSFER_TOPIC), "0x01", block, "0xtx" + block, 0L);
    }

    @Test
    @DisplayName("subscription failing twice is retried with growing backoff, then logs are processed in order")
    void start_failsTwiceThenSucceeds_reconnectsWithBackoff() {
        RawLog first = log(10);
        RawLog second = log(11);
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC)).thenReturn(
                Flux.<RawLog>error(new RpcException("connection refused")),
                Flux.<RawLog>error(new RpcException("connection reset")),
                Flux.just(first, second));
        when(processor.process(second)).thenAnswer(inv -> {
            subscriber.stop();
            return ProcessOutcome.RECORDED;
        });

        subscriber.start();

        verify(client, times(3)).subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC);
        verify(processor).process(first);
        verify(processor).process(second);
        assertThat(sleeps).containsExactly(100L, 200L);
        IngestionStatus status = stats.snapshot();
        assertThat(status.subscribeAttempts()).isEqualTo(3);
        assertThat(status.reconnects()).isEqualTo(2);
        assertThat(status.connected()).isFalse();
        assertThat(status.running()).isFalse();
        assertThat(status.lastError()).isEqualTo("connection reset");
        assertThat(subscriber.isRunning()).isFalse();
        assertThat(subscriber.isTaskAlive()).isFalse();
    }

    @Test
    void start_streamEnds_resubscribes() {
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC))
                .thenReturn(Flux.empty())
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return Flux.empty();
                });

        subscriber.start();

        verify(client, times(2)).subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC);
        assertThat(sleeps).containsExactly(100L);
        assertThat(stats.snapshot().lastError()).isEqualTo("Log stream ended");
    }

    @Test
    void start_backoffResetsAfterSuccessfulConnection() {
        RawLog first = log(10);
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC)).thenReturn(
                Flux.<RawLog>error(new RpcException("down")),
                Flux.just(first),
                Flux.<RawLog>error(new RpcException("down again")))
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return Flux.<RawLog>empty();
                });

        subscriber.start();

        // 100 after the first failure; after a connection that delivered logs the attempt counter starts over
        assertThat(sleeps).containsExactly(100L, 100L, 200L);
    }

    @Test
    void start_onReconnect_reportsChainHeadGap() {
        when(chainHeadProbe.isEnabled()).thenReturn(true);
        when(chainHeadProbe.currentBlock()).thenReturn(OptionalLong.of(500L));
        RawLog first = log(10);
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC))
                .thenReturn(Flux.just(first))
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return Flux.<RawLog>empty();
                });
        when(processor.process(first)).thenAnswer(inv -> {
            stats.onLogReceived(first.blockNumber());
            return ProcessOutcome.IRRELEVANT;
        });

        subscriber.start();

        verify(chainHeadProbe, times(1)).currentBlock();
        assertThat(stats.lastProcessedBlock()).isEqualTo(10L);
    }

    @Test
    void start_chainHeadLookupFailure_doesNotStopReconnecting() {
        when(chainHeadProbe.isEnabled()).thenReturn(true);
        when(chainHeadProbe.currentBlock()).thenThrow(new RpcException("head lookup down"));
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC))
                .thenReturn(Flux.<RawLog>error(new RpcException("down")))
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return Flux.<RawLog>empty();
                });

        subscriber.start();

        verify(client, times(2)).subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC);
    }

    @Test
    void start_chainHeadLookupThrowsUnexpected_stillResubscribes() {
        when(chainHeadProbe.isEnabled()).thenReturn(true);
        when(chainHeadProbe.currentBlock()).thenThrow(new IllegalStateException("malformed head response"));
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC))
                .thenReturn(Flux.<RawLog>empty())
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return Flux.<RawLog>empty();
                });

        subscriber.start();

        verify(client, times(2)).subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC);
        assertThat(subscriber.isTaskAlive()).isFalse();
    }

    @Test
    @DisplayName("a silent HTTP endpoint cannot hold up resubscription after the stream ends")
    void start_httpEndpointNeverReplies_stillResubscribes() {
        EvmRpcClient silentRpc = (endpoint, method, params) -> Mono.never();
        RateLimiter rateLimiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(100)
                .timeoutDuration(Duration.ofMillis(100))
                .build());
        ChainHeadProbe headLookup = new ChainHeadProbe(silentRpc,
                new RpcEndpointRotator(List.of("https://silent"), new RetryPolicy(1L, 0, 1L, 1)),
                rateLimiter, new ObjectMapper(), sleeps::add, Duration.ofMillis(50));
        TokenProperties token = new TokenProperties();
        token.setContractAddress(CONTRACT);
        ChainLogSubscriber withRealLookup = new ChainLogSubscriber(client, processor, headLookup,
                new RetryPolicy(100L, 0, 10_000L, 5), sleeps::add, stats, token, new SubscriberProperties(), Runnable::run);
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC))
                .thenReturn(Flux.<RawLog>empty())
                .thenAnswer(inv -> {
                    withRealLookup.stop();
                    return Flux.<RawLog>empty();
                });

        assertTimeoutPreemptively(Duration.ofSeconds(5), withRealLookup::start);

        verify(client, times(2)).subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC);
        assertThat(stats.snapshot().subscribeAttempts()).isEqualTo(2);
        assertThat(withRealLookup.isTaskAlive()).isFalse();
    }

    @Test
    void restartIfDead_taskDiedWhileRunning_relaunches() {
        RawLog first = log(10);
        when(client.subscribeLogs(CONTRACT, TransferDecoder.TRANSFER_TOPIC)).thenReturn(Flux.just(first));
        when(processor.process(first))
                .thenThrow(new Error("boom"))
                .thenAnswer(inv -> {
                    subscriber.stop();
                    return ProcessOutcome.RECORDED;
                });

        assertThatThrownBy(subscriber::start).isInstanceOf(Error.class).hasMessage("boom");
        assertThat(subscriber.isRunning()).isTrue();
        assertThat(subscriber.isTaskAlive()).isFalse();

        assertThat(subscriber.restartIfDead()).isTrue();

        verify(processor, times(2)).process(first);
        assertThat(subscriber.isRunning()).isFalse();
        assertThat(subscriber.restartIfDead()).isFalse();
    }

    @Test
    void restartIfDead_notStarted_noop() {
        assertThat(subscriber.restartIfDead()).isFalse();
        verify(client, never()).subscribeLogs(any(), eq(TransferDecoder.TRANSFER_TOPIC));
    }

    @Test
    void isAutoStartup_followsEnabledFlag() {
        SubscriberProperties disabled = new SubscriberProperties();
        disabled.setEnabled(false);
        ChainLogSubscriber off = new ChainLogSubscriber(client, processor, chainHeadProbe,
                RetryPolicy.defaultPolicy(), sleeps::add, stats, new TokenProperties(), disabled, Runnable::run);

        assertThat(off.isAutoStartup()).isFalse();
        assertThat(subscriber.isAutoStartup()).isTrue();
    }
}

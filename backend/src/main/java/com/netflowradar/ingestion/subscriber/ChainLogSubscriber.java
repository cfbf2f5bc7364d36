package com.netflowradar.ingestion.subscriber;

import com.netflowradar.common.RetryPolicy;
import com.netflowradar.common.Sleeper;
import com.netflowradar.config.AsyncConfig;
import com.netflowradar.ingestion.adapter.RpcException;
import com.netflowradar.ingestion.adapter.evm.ChainHeadProbe;
import com.netflowradar.ingestion.adapter.evm.EvmLogSubscriptionClient;
import com.netflowradar.ingestion.config.SubscriberProperties;
import com.netflowradar.ingestion.config.TokenProperties;
import com.netflowradar.ingestion.decoder.RawLog;
import com.netflowradar.ingestion.decoder.TransferDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Long-lived Transfer log subscription for the monitored token. Sole writer of ledger and netflow rows.
 * <p>
 * Logs are processed one at a time in delivery order on a single thread. When the stream fails or ends the
 * subscription is reopened with exponential backoff, without limit. There is no resume cursor: transfers emitted
 * while disconnected are not observed.
 */
@Slf4j
@Component
public class ChainLogSubscriber implements SmartLifecycle {

    private final EvmLogSubscriptionClient subscriptionClient;
    private final TransferLogProcessor processor;
    private final ChainHeadProbe chainHeadProbe;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final IngestionStats stats;
    private final TokenProperties tokenProperties;
    private final SubscriberProperties subscriberProperties;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean taskAlive = new AtomicBoolean(false);
    private volatile Thread worker;

    public ChainLogSubscriber(EvmLogSubscriptionClient subscriptionClient,
                              TransferLogProcessor processor,
                              ChainHeadProbe chainHeadProbe,
                              RetryPolicy ingestionRetryPolicy,
                              Sleeper sleeper,
                              IngestionStats stats,
                              TokenProperties tokenProperties,
                              SubscriberProperties subscriberProperties,
                              @Qualifier(AsyncConfig.SUBSCRIBER_EXECUTOR) Executor executor) {
        this.subscriptionClient = subscriptionClient;
        this.processor = processor;
        this.chainHeadProbe = chainHeadProbe;
        this.retryPolicy = ingestionRetryPolicy;
        this.sleeper = sleeper;
        this.stats = stats;
        this.tokenProperties = tokenProperties;
        this.subscriberProperties = subscriberProperties;
        this.executor = executor;
    }

    @Override
    public boolean isAutoStartup() {
        return subscriberProperties.isEnabled();
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        stats.setRunning(true);
        launch();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stats.setRunning(false);
        Thread t = worker;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
        log.info("Chain log subscriber stopping");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** True while the subscription task is executing on its thread. */
    public boolean isTaskAlive() {
        return taskAlive.get();
    }

    /**
     * Relaunches the subscription task if it died while the subscriber is meant to be running.
     *
     * @return true if a restart was triggered
     */
    public boolean restartIfDead() {
        if (running.get() && taskAlive.compareAndSet(false, true)) {
            log.warn("Chain log subscriber task is not alive; restarting");
            submit();
            return true;
        }
        return false;
    }

    private void launch() {
        taskAlive.set(true);
        submit();
    }

    private void submit() {
        executor.execute(() -> {
            worker = Thread.currentThread();
            try {
                subscribeUntilStopped();
            } catch (Error e) {
                log.error("Chain log subscriber task died", e);
                throw e;
            } finally {
                worker = null;
                taskAlive.set(false);
            }
        });
    }

    private void subscribeUntilStopped() {
        String contract = tokenProperties.getContractAddress();
        int attempt = 0;
        log.info("Subscribing to Transfer logs of {}", contract);
        while (running.get()) {
            stats.onSubscribeAttempt();
            if (attempt > 0) {
                reportGap();
            }
            String disconnectReason;
            boolean connected = false;
            try (Stream<RawLog> logs = subscriptionClient.subscribeLogs(contract, TransferDecoder.TRANSFER_TOPIC).toStream()) {
                Iterator<RawLog> it = logs.iterator();
                while (running.get() && it.hasNext()) {
                    RawLog rawLog = it.next();
                    if (!connected) {
                        connected = true;
                        if (attempt > 0) {
                            log.info("Log subscription re-established after {} failed attempt(s)", attempt);
                        }
                        attempt = 0;
                        stats.onConnected();
                    }
                    processor.process(rawLog);
                }
                if (!running.get()) {
                    stats.onDisconnected(null);
                    break;
                }
                disconnectReason = "Log stream ended";
                log.warn("Transfer log stream ended");
            } catch (RpcException e) {
                disconnectReason = e.getMessage();
                log.warn("Log subscription failed (attempt {}): {}", attempt + 1, e.getMessage());
            } catch (RuntimeException e) {
                if (!running.get()) {
                    break;
                }
                disconnectReason = "Unexpected: " + e.getMessage();
                log.error("Unexpected failure in log subscription; restarting it", e);
            }
            stats.onDisconnected(disconnectReason);
            if (!running.get()) {
                break;
            }
            long delayMs = retryPolicy.delayMs(attempt);
            attempt++;
            log.info("Reconnecting log subscription in {} ms (attempt {})", delayMs, attempt + 1);
            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Chain log subscriber stopped");
    }

    private void reportGap() {
        if (!chainHeadProbe.isEnabled()) {
            return;
        }
        try {
            OptionalLong head = chainHeadProbe.currentBlock();
            Long last = stats.lastProcessedBlock();
            if (head.isPresent() && last != null && head.getAsLong() > last) {
                log.warn("Chain head is {}, last processed block {}: transfers in up to {} blocks were not observed",
                        head.getAsLong(), last, head.getAsLong() - last);
            } else if (head.isPresent()) {
                log.info("Chain head is {} before resubscribing", head.getAsLong());
            }
        } catch (RpcException e) {
            log.warn("Chain head lookup failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            // the gap report is informational; resubscription proceeds regardless
            log.error("Unexpected failure resolving chain head before resubscribing", e);
        }
    }
}

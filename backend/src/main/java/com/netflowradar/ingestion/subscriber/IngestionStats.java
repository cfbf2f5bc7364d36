package com.netflowradar.ingestion.subscriber;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory ingestion counters. Written by the subscriber thread, read by status requests.
 * Reset on restart.
 */
@Component
public class IngestionStats {

    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean connected = new AtomicBoolean();
    private final AtomicLong subscribeAttempts = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong logsReceived = new AtomicLong();
    private final AtomicLong transfersDecoded = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong irrelevantTransfers = new AtomicLong();
    private final AtomicLong flowsRecorded = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicReference<Long> lastProcessedBlock = new AtomicReference<>();
    private final AtomicReference<Instant> lastLogAt = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicReference<Instant> lastErrorAt = new AtomicReference<>();

    public IngestionStats(Clock clock) {
        this.clock = clock;
    }

    void setRunning(boolean value) {
        running.set(value);
    }

    void onSubscribeAttempt() {
        if (subscribeAttempts.incrementAndGet() > 1) {
            reconnects.incrementAndGet();
        }
    }

    void onConnected() {
        connected.set(true);
    }

    void onDisconnected(String reason) {
        connected.set(false);
        if (reason != null) {
            onError(reason);
        }
    }

    void onLogReceived(Long blockNumber) {
        logsReceived.incrementAndGet();
        lastLogAt.set(clock.instant());
        if (blockNumber != null) {
            lastProcessedBlock.set(blockNumber);
        }
    }

    void onDecoded() {
        transfersDecoded.incrementAndGet();
    }

    void onDecodeFailure(String reason) {
        decodeFailures.incrementAndGet();
        onError(reason);
    }

    void onIrrelevant() {
        irrelevantTransfers.incrementAndGet();
    }

    void onRecorded() {
        flowsRecorded.incrementAndGet();
    }

    void onStoreFailure(String reason) {
        storeFailures.incrementAndGet();
        onError(reason);
    }

    private void onError(String reason) {
        lastError.set(reason);
        lastErrorAt.set(clock.instant());
    }

    public Long lastProcessedBlock() {
        return lastProcessedBlock.get();
    }

    public IngestionStatus snapshot() {
        return new IngestionStatus(
                running.get(),
                connected.get(),
                subscribeAttempts.get(),
                reconnects.get(),
                logsReceived.get(),
                transfersDecoded.get(),
                decodeFailures.get(),
                irrelevantTransfers.get(),
                flowsRecorded.get(),
                storeFailures.get(),
                lastProcessedBlock.get(),
                lastLogAt.get(),
                lastError.get(),
                lastErrorAt.get());
    }
}

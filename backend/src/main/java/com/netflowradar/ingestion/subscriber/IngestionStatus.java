package com.netflowradar.ingestion.subscriber;

import java.time.Instant;

/**
 * Point-in-time copy of the subscriber counters.
 */
public record IngestionStatus(
        boolean running,
        boolean connected,
        long subscribeAttempts,
        long reconnects,
        long logsReceived,
        long transfersDecoded,
        long decodeFailures,
        long irrelevantTransfers,
        long flowsRecorded,
        long storeFailures,
        Long lastProcessedBlock,
        Instant lastLogAt,
        String lastError,
        Instant lastErrorAt
) {
}

package com.netflowradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflowradar.ingestion.subscriber.IngestionStatus;

/**
 * GET /api/v1/ingestion/status response.
 */
public record IngestionStatusResponse(
        boolean running,
        boolean connected,
        @JsonProperty("subscribe_attempts") long subscribeAttempts,
        long reconnects,
        @JsonProperty("logs_received") long logsReceived,
        @JsonProperty("transfers_decoded") long transfersDecoded,
        @JsonProperty("decode_failures") long decodeFailures,
        @JsonProperty("irrelevant_transfers") long irrelevantTransfers,
        @JsonProperty("flows_recorded") long flowsRecorded,
        @JsonProperty("store_failures") long storeFailures,
        @JsonProperty("last_processed_block") Long lastProcessedBlock,
        @JsonProperty("last_log_at") String lastLogAt,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("last_error_at") String lastErrorAt
) {

    public static IngestionStatusResponse from(IngestionStatus s) {
        return new IngestionStatusResponse(
                s.running(),
                s.connected(),
                s.subscribeAttempts(),
                s.reconnects(),
                s.logsReceived(),
                s.transfersDecoded(),
                s.decodeFailures(),
                s.irrelevantTransfers(),
                s.flowsRecorded(),
                s.storeFailures(),
                s.lastProcessedBlock(),
                s.lastLogAt() != null ? s.lastLogAt().toString() : null,
                s.lastError(),
                s.lastErrorAt() != null ? s.lastErrorAt().toString() : null);
    }
}

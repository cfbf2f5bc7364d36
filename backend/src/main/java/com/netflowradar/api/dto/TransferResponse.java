package com.netflowradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflowradar.domain.TransferRecord;

/**
 * One ledger entry. amount is a base-10 string.
 */
public record TransferResponse(
        long sequence,
        String exchange,
        String direction,
        @JsonProperty("block_number") Long blockNumber,
        @JsonProperty("tx_hash") String transactionHash,
        @JsonProperty("log_index") Long logIndex,
        @JsonProperty("from_address") String fromAddress,
        @JsonProperty("to_address") String toAddress,
        String amount,
        @JsonProperty("observed_at") String observedAt
) {

    public static TransferResponse from(TransferRecord r) {
        return new TransferResponse(
                r.getSequence() != null ? r.getSequence() : 0L,
                r.getExchange(),
                r.getDirection() != null ? r.getDirection().name() : null,
                r.getBlockNumber(),
                r.getTransactionHash(),
                r.getLogIndex(),
                r.getFromAddress(),
                r.getToAddress(),
                r.getAmount() != null ? r.getAmount().toString() : null,
                r.getObservedAt() != null ? r.getObservedAt().toString() : null);
    }
}

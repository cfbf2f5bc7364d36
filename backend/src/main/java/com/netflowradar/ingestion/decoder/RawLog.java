package com.netflowradar.ingestion.decoder;

import java.util.List;

/**
 * Log entry as delivered by the node: topics and data are 0x-prefixed hex strings.
 * blockNumber and logIndex may be null when the provider omits them.
 */
public record RawLog(
        String address,
        List<String> topics,
        String data,
        Long blockNumber,
        String transactionHash,
        Long logIndex
) {

    public RawLog {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}

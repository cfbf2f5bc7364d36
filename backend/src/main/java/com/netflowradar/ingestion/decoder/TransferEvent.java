package com.netflowradar.ingestion.decoder;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Decoded ERC20 Transfer(address,address,uint256). Addresses are canonical lower-case;
 * amount is the full unsigned value, never narrowed.
 */
public record TransferEvent(
        String fromAddress,
        String toAddress,
        BigInteger amount,
        Long blockNumber,
        String transactionHash,
        Long logIndex,
        Instant observedAt
) {
}

package com.netflowradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Append-only ledger entry: one per observed transfer touching a monitored address. Never updated or deleted.
 * Amount is an unsigned 256-bit token quantity, persisted as a decimal string.
 */
@Document(collection = "transfers")
@CompoundIndexes({
    @CompoundIndex(name = "exchange_sequence", def = "{'exchange': 1, 'sequence': -1}"),
    @CompoundIndex(name = "txHash_logIndex", def = "{'transactionHash': 1, 'logIndex': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransferRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Monotonic across the ledger; assigned by the store inside the write transaction. */
    @Indexed(unique = true)
    private Long sequence;
    private String exchange;
    private FlowDirection direction;
    private Long blockNumber;
    private String transactionHash;
    private Long logIndex;
    private String fromAddress;
    private String toAddress;
    private BigInteger amount;
    /** When the subscriber received the log. */
    private Instant observedAt;
    private Instant insertedAt;
}

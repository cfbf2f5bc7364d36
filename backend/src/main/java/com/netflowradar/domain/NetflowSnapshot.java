package com.netflowradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One row per netflow update for an exchange. The current value for an exchange is the row with the greatest
 * sequence. Rows are only ever appended; cumulativeNetflow is recomputed from the prior row, never mutated.
 */
@Document(collection = "netflows")
@CompoundIndex(name = "exchange_sequence", def = "{'exchange': 1, 'sequence': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NetflowSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private Long sequence;
    private String exchange;
    private BigInteger inflow;
    private BigInteger outflow;
    /** Signed running total of (inflow - outflow) for this exchange. */
    private BigInteger cumulativeNetflow;
    private Instant lastUpdated;

    /**
     * Builds the successor of {@code prior} (null = no snapshot yet) for a single inflow/outflow delta.
     * Sequence and id are left for the store to assign.
     */
    public static NetflowSnapshot next(NetflowSnapshot prior, String exchange,
                                       BigInteger inflow, BigInteger outflow, Instant at) {
        if (inflow == null || outflow == null || inflow.signum() < 0 || outflow.signum() < 0) {
            throw new IllegalArgumentException("inflow and outflow must be non-negative");
        }
        BigInteger priorCumulative = prior != null && prior.getCumulativeNetflow() != null
                ? prior.getCumulativeNetflow()
                : BigInteger.ZERO;
        NetflowSnapshot s = new NetflowSnapshot();
        s.setExchange(exchange);
        s.setInflow(inflow);
        s.setOutflow(outflow);
        s.setCumulativeNetflow(priorCumulative.add(inflow).subtract(outflow));
        s.setLastUpdated(at);
        return s;
    }
}

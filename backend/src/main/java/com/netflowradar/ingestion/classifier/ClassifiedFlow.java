package com.netflowradar.ingestion.classifier;

import com.netflowradar.domain.FlowDirection;

import java.math.BigInteger;

/**
 * Signed contribution of one transfer to one exchange. At most one of inflow/outflow is non-zero;
 * both zero means the transfer does not touch the exchange.
 */
public record ClassifiedFlow(String exchangeLabel, BigInteger inflowAmount, BigInteger outflowAmount) {

    public static ClassifiedFlow none(String exchangeLabel) {
        return new ClassifiedFlow(exchangeLabel, BigInteger.ZERO, BigInteger.ZERO);
    }

    public boolean isRelevant() {
        return inflowAmount.signum() != 0 || outflowAmount.signum() != 0;
    }

    /** Null when the flow is not relevant. */
    public FlowDirection direction() {
        if (inflowAmount.signum() != 0) return FlowDirection.INFLOW;
        if (outflowAmount.signum() != 0) return FlowDirection.OUTFLOW;
        return null;
    }
}

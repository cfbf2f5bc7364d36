package com.netflowradar.ingestion.store;

import com.netflowradar.domain.NetflowSnapshot;
import com.netflowradar.domain.TransferRecord;

import java.math.BigInteger;

/**
 * Write path of the persistent store. The subscriber is its only caller.
 */
public interface NetflowStore {

    /**
     * Appends the ledger entry and a new netflow snapshot for {@code exchangeLabel} as one atomic unit:
     * cumulative = prior cumulative (zero if none) + inflow - outflow.
     *
     * @return the committed snapshot
     * @throws NetflowStoreException if the unit could not be committed; neither row is then visible
     */
    NetflowSnapshot record(String exchangeLabel, TransferRecord transfer, BigInteger inflow, BigInteger outflow);
}

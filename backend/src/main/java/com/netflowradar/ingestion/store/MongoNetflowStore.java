package com.netflowradar.ingestion.store;

import com.netflowradar.domain.FlowDirection;
import com.netflowradar.domain.NetflowSnapshot;
import com.netflowradar.domain.SequenceCounter;
import com.netflowradar.domain.TransferRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB implementation of the netflow write path. Ledger insert, snapshot read and snapshot insert run in one
 * multi-document transaction; readers see either the state before or after, never a ledger row without its snapshot.
 */
@Slf4j
@Service
public class MongoNetflowStore implements NetflowStore, InitializingBean {

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SequenceGenerator sequenceGenerator;
    private final Clock clock;

    public MongoNetflowStore(MongoTemplate mongoTemplate,
                             TransactionTemplate transactionTemplate,
                             SequenceGenerator sequenceGenerator,
                             Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = transactionTemplate;
        this.sequenceGenerator = sequenceGenerator;
        this.clock = clock;
    }

    /** Collections must exist before the first transactional write. Idempotent. */
    @Override
    public void afterPropertiesSet() {
        for (Class<?> type : List.of(TransferRecord.class, NetflowSnapshot.class, SequenceCounter.class)) {
            if (!mongoTemplate.collectionExists(type)) {
                mongoTemplate.createCollection(type);
                log.info("Created collection {}", mongoTemplate.getCollectionName(type));
            }
        }
    }

    @Override
    public NetflowSnapshot record(String exchangeLabel, TransferRecord transfer, BigInteger inflow, BigInteger outflow) {
        if (exchangeLabel == null || transfer == null) {
            throw new IllegalArgumentException("exchangeLabel and transfer are required");
        }
        try {
            NetflowSnapshot saved = transactionTemplate.execute(status -> write(exchangeLabel, transfer, inflow, outflow));
            if (saved == null) {
                throw new IllegalStateException("Transaction returned no snapshot");
            }
            return saved;
        } catch (DataAccessException | TransactionException e) {
            throw new NetflowStoreException("Failed to record transfer " + transfer.getTransactionHash()
                    + " for " + exchangeLabel + ": " + e.getMessage(), e);
        }
    }

    private NetflowSnapshot write(String exchangeLabel, TransferRecord transfer, BigInteger inflow, BigInteger outflow) {
        Instant now = clock.instant();
        transfer.setId(null);
        transfer.setExchange(exchangeLabel);
        transfer.setDirection(inflow.signum() != 0 ? FlowDirection.INFLOW : FlowDirection.OUTFLOW);
        transfer.setSequence(sequenceGenerator.next(SequenceGenerator.TRANSFERS));
        transfer.setInsertedAt(now);
        mongoTemplate.insert(transfer);

        NetflowSnapshot prior = mongoTemplate.findOne(
                new Query(where("exchange").is(exchangeLabel)).with(Sort.by(Sort.Direction.DESC, "sequence")).limit(1),
                NetflowSnapshot.class);
        NetflowSnapshot next = NetflowSnapshot.next(prior, exchangeLabel, inflow, outflow, now);
        next.setSequence(sequenceGenerator.next(SequenceGenerator.NETFLOWS));
        NetflowSnapshot saved = mongoTemplate.insert(next);
        log.debug("Recorded {} {} for {} (ledger #{}, snapshot #{}, cumulative {})",
                transfer.getDirection(), transfer.getAmount(), exchangeLabel,
                transfer.getSequence(), saved.getSequence(), saved.getCumulativeNetflow());
        return saved;
    }
}

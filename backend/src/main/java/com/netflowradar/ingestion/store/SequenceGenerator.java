package com.netflowradar.ingestion.store;

import com.netflowradar.domain.SequenceCounter;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Monotonic counters backed by the counters collection. Participates in the caller's transaction,
 * so an aborted write does not consume a value.
 */
@Component
@RequiredArgsConstructor
public class SequenceGenerator {

    public static final String TRANSFERS = "transfers";
    public static final String NETFLOWS = "netflows";

    private final MongoTemplate mongoTemplate;

    public long next(String counterName) {
        SequenceCounter counter = mongoTemplate.findAndModify(
                new Query(where("_id").is(counterName)),
                new Update().inc("value", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounter.class);
        if (counter == null) {
            throw new IllegalStateException("Counter " + counterName + " was not returned after upsert");
        }
        return counter.getValue();
    }
}

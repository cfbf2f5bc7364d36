package com.netflowradar.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for netflow snapshots. "Latest" always means greatest sequence.
 */
public interface NetflowSnapshotRepository extends MongoRepository<NetflowSnapshot, String> {

    Optional<NetflowSnapshot> findFirstByExchangeOrderBySequenceDesc(String exchange);

    /** Latest snapshot regardless of exchange. */
    Optional<NetflowSnapshot> findFirstByOrderBySequenceDesc();

    List<NetflowSnapshot> findByExchangeOrderBySequenceDesc(String exchange, Pageable pageable);

    long countByExchange(String exchange);
}

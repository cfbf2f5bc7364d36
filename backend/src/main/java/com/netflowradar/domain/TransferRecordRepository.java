package com.netflowradar.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to the transfer ledger. Writes go through the netflow store only.
 */
public interface TransferRecordRepository extends MongoRepository<TransferRecord, String> {

    List<TransferRecord> findByExchangeOrderBySequenceDesc(String exchange, Pageable pageable);

    long countByExchange(String exchange);
}

package com.netflowradar.ingestion.subscriber;

import com.netflowradar.domain.NetflowSnapshot;
import com.netflowradar.domain.TransferRecord;
import com.netflowradar.ingestion.classifier.ClassifiedFlow;
import com.netflowradar.ingestion.classifier.NetflowClassifier;
import com.netflowradar.ingestion.decoder.RawLog;
import com.netflowradar.ingestion.decoder.TransferDecodeException;
import com.netflowradar.ingestion.decoder.TransferDecoder;
import com.netflowradar.ingestion.decoder.TransferEvent;
import com.netflowradar.ingestion.registry.ExchangeRegistry;
import com.netflowradar.ingestion.store.NetflowStore;
import com.netflowradar.ingestion.store.NetflowStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decode, classify and persist one log. Decode and store failures are logged, counted and swallowed here so the
 * subscription keeps going; nothing from this class propagates to the subscriber loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferLogProcessor {

    private final TransferDecoder decoder;
    private final NetflowClassifier classifier;
    private final ExchangeRegistry registry;
    private final NetflowStore store;
    private final IngestionStats stats;

    public ProcessOutcome process(RawLog rawLog) {
        stats.onLogReceived(rawLog.blockNumber());
        TransferEvent event;
        try {
            event = decoder.decode(rawLog);
        } catch (TransferDecodeException e) {
            log.warn("Skipping undecodable log ({}): {}", e.getError(), e.getMessage());
            stats.onDecodeFailure(e.getError() + ": " + e.getMessage());
            return ProcessOutcome.DECODE_FAILED;
        }
        stats.onDecoded();

        List<ClassifiedFlow> flows = classifier.classifyAll(event, registry);
        if (flows.isEmpty()) {
            stats.onIrrelevant();
            return ProcessOutcome.IRRELEVANT;
        }
        boolean failed = false;
        for (ClassifiedFlow flow : flows) {
            try {
                NetflowSnapshot snapshot = store.record(
                        flow.exchangeLabel(), toRecord(event), flow.inflowAmount(), flow.outflowAmount());
                stats.onRecorded();
                log.info("{} {} {} (tx {}, block {}) cumulative netflow {}",
                        flow.exchangeLabel(), flow.direction(), event.amount(),
                        event.transactionHash(), event.blockNumber(), snapshot.getCumulativeNetflow());
            } catch (NetflowStoreException e) {
                failed = true;
                log.error("Netflow write failed for {} tx {} log {}: {}",
                        flow.exchangeLabel(), event.transactionHash(), event.logIndex(), e.getMessage(), e);
                stats.onStoreFailure(e.getMessage());
            }
        }
        return failed ? ProcessOutcome.STORE_FAILED : ProcessOutcome.RECORDED;
    }

    private static TransferRecord toRecord(TransferEvent event) {
        TransferRecord record = new TransferRecord();
        record.setBlockNumber(event.blockNumber());
        record.setTransactionHash(event.transactionHash());
        record.setLogIndex(event.logIndex());
        record.setFromAddress(event.fromAddress());
        record.setToAddress(event.toAddress());
        record.setAmount(event.amount());
        record.setObservedAt(event.observedAt());
        return record;
    }
}

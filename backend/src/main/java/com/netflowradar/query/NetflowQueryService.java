package com.netflowradar.query;

import com.netflowradar.domain.NetflowSnapshot;
import com.netflowradar.domain.NetflowSnapshotRepository;
import com.netflowradar.domain.TransferRecord;
import com.netflowradar.domain.TransferRecordRepository;
import com.netflowradar.ingestion.registry.ExchangeRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the netflow store. Never writes; safe to call while the subscriber is writing because each
 * snapshot is committed together with its ledger entry.
 */
@Service
@RequiredArgsConstructor
public class NetflowQueryService {

    public static final int MAX_PAGE_SIZE = 500;

    private final NetflowSnapshotRepository snapshotRepository;
    private final TransferRecordRepository transferRepository;
    private final ExchangeRegistry exchangeRegistry;

    public boolean isKnownExchange(String exchange) {
        return exchangeRegistry.isKnown(exchange);
    }

    /** Highest-sequence snapshot for the exchange; empty if nothing was ever recorded for it. */
    public Optional<NetflowSnapshot> latest(String exchange) {
        return snapshotRepository.findFirstByExchangeOrderBySequenceDesc(exchange);
    }

    /** Most recent snapshot across all exchanges. */
    public Optional<NetflowSnapshot> latestAny() {
        return snapshotRepository.findFirstByOrderBySequenceDesc();
    }

    /** Newest first. */
    public List<NetflowSnapshot> history(String exchange, int limit) {
        return snapshotRepository.findByExchangeOrderBySequenceDesc(exchange, PageRequest.of(0, clamp(limit)));
    }

    /** Newest first. */
    public List<TransferRecord> recentTransfers(String exchange, int limit) {
        return transferRepository.findByExchangeOrderBySequenceDesc(exchange, PageRequest.of(0, clamp(limit)));
    }

    public List<ExchangeSummary> exchanges() {
        return exchangeRegistry.exchanges().stream()
                .map(e -> new ExchangeSummary(e.label(), e.size(), latest(e.label()).isPresent()))
                .toList();
    }

    static int clamp(int limit) {
        if (limit < 1) return 1;
        return Math.min(limit, MAX_PAGE_SIZE);
    }

    public record ExchangeSummary(String exchange, int monitoredAddresses, boolean hasNetflow) {
    }
}

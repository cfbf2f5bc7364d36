package com.netflowradar.ingestion.subscriber;

import com.netflowradar.domain.NetflowSnapshot;
import com.netflowradar.domain.TransferRecord;
import com.netflowradar.ingestion.classifier.NetflowClassifier;
import com.netflowradar.ingestion.decoder.RawLog;
import com.netflowradar.ingestion.decoder.TransferDecoder;
import com.netflowradar.ingestion.registry.ExchangeRegistry;
import com.netflowradar.ingestion.store.NetflowStore;
import com.netflowradar.ingestion.store.NetflowStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransferLogProcessorTest {

    private static final String BINANCE = "0xf977814e90da44bfa03b6295a0616a897441acec";
    private static final String KRAKEN = "0x2910543af39aba0cd09dbb2d50200b3e800a63d2";
    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String OTHER = "0x2222222222222222222222222222222222222222";

    @Mock
    NetflowStore store;

    private IngestionStats stats;
    private TransferLogProcessor processor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        Map<String, List<String>> exchanges = new LinkedHashMap<>();
        exchanges.put("binance", List.of(BINANCE));
        exchanges.put("kraken", List.of(KRAKEN));
        stats = new IngestionStats(clock);
        processor = new TransferLogProcessor(new TransferDecoder(clock), new NetflowClassifier(),
                new ExchangeRegistry(exchanges), store, stats);
    }

    private static RawLog transferLog(String from, String to, long amount) {
        return new RawLog("0x0000000000000000000000000000000000001010",
                List.of(TransferDecoder.TRANSFER_TOPIC, pad(from), pad(to)),
                "0x" + String.format("%064x", amount), 77L, "0xtx", 4L);
    }

    private static String pad(String address) {
        return "0x000000000000000000000000" + address.substring(2);
    }

    private static NetflowSnapshot snapshot(long cumulative) {
        NetflowSnapshot s = new NetflowSnapshot();
        s.setCumulativeNetflow(BigInteger.valueOf(cumulative));
        return s;
    }

    @Test
    void process_inflow_recordsTransferAndSnapshot() {
        when(store.record(eq("binance"), any(), any(), any())).thenReturn(snapshot(1000));

        ProcessOutcome outcome = processor.process(transferLog(USER, BINANCE, 1000));

        assertThat(outcome).isEqualTo(ProcessOutcome.RECORDED);
        ArgumentCaptor<TransferRecord> record = ArgumentCaptor.forClass(TransferRecord.class);
        verify(store).record(eq("binance"), record.capture(), eq(BigInteger.valueOf(1000)), eq(BigInteger.ZERO));
        assertThat(record.getValue().getFromAddress()).isEqualTo(USER);
        assertThat(record.getValue().getToAddress()).isEqualTo(BINANCE);
        assertThat(record.getValue().getAmount()).isEqualTo(BigInteger.valueOf(1000));
        assertThat(record.getValue().getBlockNumber()).isEqualTo(77L);
        assertThat(record.getValue().getTransactionHash()).isEqualTo("0xtx");
        assertThat(stats.snapshot().flowsRecorded()).isEqualTo(1);
        assertThat(stats.lastProcessedBlock()).isEqualTo(77L);
    }

    @Test
    void process_outflow_recordsOutflowAmount() {
        when(store.record(eq("binance"), any(), any(), any())).thenReturn(snapshot(-200));

        assertThat(processor.process(transferLog(BINANCE, USER, 200))).isEqualTo(ProcessOutcome.RECORDED);

        verify(store).record(eq("binance"), any(), eq(BigInteger.ZERO), eq(BigInteger.valueOf(200)));
    }

    @Test
    void process_unrelatedTransfer_noWrite() {
        assertThat(processor.process(transferLog(USER, OTHER, 5))).isEqualTo(ProcessOutcome.IRRELEVANT);

        verifyNoInteractions(store);
        assertThat(stats.snapshot().irrelevantTransfers()).isEqualTo(1);
    }

    @Test
    void process_malformedLog_skippedAndCounted() {
        RawLog malformed = new RawLog("0x0000000000000000000000000000000000001010",
                List.of(TransferDecoder.TRANSFER_TOPIC, pad(USER)), "0x01", 78L, "0xbad", 0L);

        assertThat(processor.process(malformed)).isEqualTo(ProcessOutcome.DECODE_FAILED);

        verifyNoInteractions(store);
        assertThat(stats.snapshot().decodeFailures()).isEqualTo(1);
        assertThat(stats.snapshot().lastError()).startsWith("MALFORMED_LOG");
        assertThat(stats.snapshot().logsReceived()).isEqualTo(1);
    }

    @Test
    void process_storeFailure_reportedNotThrown() {
        when(store.record(any(), any(), any(), any())).thenThrow(new NetflowStoreException("write conflict", null));

        assertThat(processor.process(transferLog(USER, BINANCE, 10))).isEqualTo(ProcessOutcome.STORE_FAILED);

        assertThat(stats.snapshot().storeFailures()).isEqualTo(1);
        assertThat(stats.snapshot().lastError()).isEqualTo("write conflict");
    }

    @Test
    void process_betweenExchanges_writesOnePerExchange() {
        when(store.record(any(), any(), any(), any())).thenReturn(snapshot(0));

        assertThat(processor.process(transferLog(BINANCE, KRAKEN, 50))).isEqualTo(ProcessOutcome.RECORDED);

        verify(store).record(eq("binance"), any(), eq(BigInteger.ZERO), eq(BigInteger.valueOf(50)));
        verify(store).record(eq("kraken"), any(), eq(BigInteger.valueOf(50)), eq(BigInteger.ZERO));
        assertThat(stats.snapshot().flowsRecorded()).isEqualTo(2);
    }
}

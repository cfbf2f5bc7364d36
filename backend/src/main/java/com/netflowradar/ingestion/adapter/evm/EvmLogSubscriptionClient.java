package com.netflowradar.ingestion.adapter.evm;

import com.netflowradar.ingestion.decoder.RawLog;
import reactor.core.publisher.Flux;

/**
 * Live log stream for one contract and one event signature (eth_subscribe "logs").
 */
public interface EvmLogSubscriptionClient {

    /**
     * Opens a subscription filtered by contract address and topic0. Logs are emitted in provider delivery order.
     * The Flux errors with RpcException when the subscription cannot be opened or the connection drops, and
     * completes when the provider closes the stream. Nothing is resumed: a new call starts a fresh subscription.
     */
    Flux<RawLog> subscribeLogs(String contractAddress, String eventSignatureHash);
}

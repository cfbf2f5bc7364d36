package com.netflowradar.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * HTTP JSON-RPC client abstraction for testing and endpoint rotation.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_blockNumber"
     * @param params      method params
     * @return response body as string (JSON); errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}

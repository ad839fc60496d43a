package com.servicetracker.irita.tendermint;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Tendermint JSON-RPC over HTTP. Retries, rate limiting and endpoint rotation are handled by callers.
 */
public interface TendermintRpcClient {

    /**
     * @param endpointUrl RPC endpoint, e.g. http://localhost:26657
     * @param method      e.g. "status" or "block_results"
     * @param params      named params; heights are passed as strings
     * @return raw JSON response body; errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Map<String, Object> params);
}

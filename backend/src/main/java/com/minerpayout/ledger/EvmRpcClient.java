package com.minerpayout.ledger;

import reactor.core.publisher.Mono;

/**
 * One JSON-RPC request to one node, no retries. Endpoint choice, retries and result parsing live in
 * {@link EvmLedgerClient}.
 */
@FunctionalInterface
public interface EvmRpcClient {

    /**
     * @param params positional JSON-RPC params; null sends an empty array
     * @return raw response body; transport failures and timeouts surface as {@link RpcException}
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}

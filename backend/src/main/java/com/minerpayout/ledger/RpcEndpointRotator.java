package com.minerpayout.ledger;

import com.minerpayout.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Node endpoints in configured order. Reads rotate across all of them; submissions stay on the primary so
 * nonces are assigned by one node.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final RetryPolicy retryPolicy;
    private final AtomicInteger cursor = new AtomicInteger();

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaultPolicy() : retryPolicy;
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    public String getPrimaryEndpoint() {
        return endpoints.get(0);
    }

    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    @Override
    public String toString() {
        return "RpcEndpointRotator" + endpoints;
    }
}

package com.servicetracker.irita.tendermint;

import com.servicetracker.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the configured Tendermint RPC endpoints, carrying the retry policy used between attempts.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String nextEndpoint() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    public long retryDelayMs(int failedAttempt) {
        return retryPolicy.delayMs(failedAttempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}

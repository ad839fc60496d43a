package com.servicetracker.irita.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tendermint RPC endpoints and block polling for the IRITA event source.
 */
@ConfigurationProperties(prefix = "servicetracker.irita.rpc")
@NoArgsConstructor
@Getter
@Setter
public class IritaRpcProperties {

    /** Tendermint RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of("http://localhost:26657"));

    /** Delay between polls for new blocks, per subscription. */
    private long pollIntervalMs = 1_000;

    /** Upper bound for a single RPC call. */
    private long requestTimeoutMs = 5_000;

    /** RPC budget (requests per second) shared by all subscriptions. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a limiter permit before failing. */
    private long limiterTimeoutMs = 2_000;

    /** Largest RPC response body buffered in memory (block_results of busy blocks run to megabytes). */
    private int maxResponseBytes = 16 * 1024 * 1024;

    /** Node encodes event attribute keys/values in base64 (Tendermint 0.34). */
    private boolean base64Attributes = true;
}

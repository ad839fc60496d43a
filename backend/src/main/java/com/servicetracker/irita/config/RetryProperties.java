package com.servicetracker.irita.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for chain RPC and LCD calls (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "servicetracker.irita.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Base delay before the first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. */
    private int maxAttempts = 3;
}

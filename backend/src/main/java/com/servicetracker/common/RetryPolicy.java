package com.servicetracker.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, shared by the chain RPC and LCD clients.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Sleep before the attempt following {@code failedAttempt} (0-based): base * 2^failedAttempt, jittered.
     */
    public long delayMs(int failedAttempt) {
        long raw = baseDelayMs * (1L << Math.max(0, Math.min(failedAttempt, MAX_SHIFT)));
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, (long) (raw * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500 ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}

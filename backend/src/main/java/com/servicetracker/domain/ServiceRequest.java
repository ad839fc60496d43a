package com.servicetracker.domain;

/**
 * Service request detail as returned by the chain's request query.
 */
public record ServiceRequest(
        String id,
        String serviceName,
        String provider,
        String consumer,
        String input,
        String serviceFee,
        long requestHeight,
        long expirationHeight,
        String requestContextId,
        long batchCounter
) {
}

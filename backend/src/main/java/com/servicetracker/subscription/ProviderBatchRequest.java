package com.servicetracker.subscription;

import com.servicetracker.domain.Interest;

import java.util.List;

/**
 * Typed view of one {@code new_batch_request_provider} event. An undecodable request list is kept
 * as {@code malformed} with no ids rather than raised.
 */
public record ProviderBatchRequest(String serviceName, String provider, List<String> requestIds, boolean malformed) {

    public ProviderBatchRequest {
        requestIds = requestIds == null ? List.of() : List.copyOf(requestIds);
    }

    static ProviderBatchRequest of(String serviceName, String provider, List<String> requestIds) {
        return new ProviderBatchRequest(serviceName, provider, requestIds, false);
    }

    static ProviderBatchRequest malformed(String serviceName, String provider) {
        return new ProviderBatchRequest(serviceName, provider, List.of(), true);
    }

    public boolean matches(Interest interest) {
        return interest.serviceName().equals(serviceName) && interest.provider().equals(provider);
    }
}

package com.servicetracker.domain;

/**
 * A service request resolved for one interest, ready to trigger a run. Consumed once.
 */
public record ResolvedRequest(ServiceRequest request, String provider) {
}

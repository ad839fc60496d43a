package com.servicetracker.api.dto;

/**
 * GET /api/v1/subscriptions: tracker state and live counts.
 */
public record SubscriptionsResponse(boolean started, int jobs, int subscriptions) {
}

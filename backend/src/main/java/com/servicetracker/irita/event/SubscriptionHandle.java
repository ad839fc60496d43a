package com.servicetracker.irita.event;

/**
 * Opaque token for one open subscription; only used to unsubscribe.
 */
public record SubscriptionHandle(String id) {
}

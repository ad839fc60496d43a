package com.servicetracker.subscription;

import com.servicetracker.common.CancellationToken;
import com.servicetracker.domain.Interest;
import com.servicetracker.irita.event.SubscriptionHandle;

/**
 * Registry entry for one worker: its event-source handle and the token that stops its loop.
 * Compared by identity inside the registry.
 */
public record RegisteredSubscription(String jobId, Interest interest, SubscriptionHandle handle, CancellationToken token) {
}

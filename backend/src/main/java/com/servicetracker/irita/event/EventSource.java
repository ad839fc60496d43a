package com.servicetracker.irita.event;

/**
 * Chain event source. Implementations deliver blocks to each subscription independently,
 * so a slow listener only delays its own subscription.
 */
public interface EventSource {

    /**
     * Opens a subscription delivering every new block whose end-block events satisfy {@code query}.
     *
     * @throws SubscriptionException if the subscription cannot be opened
     */
    SubscriptionHandle subscribe(EventQuery query, BlockListener listener);

    /**
     * Closes a subscription. Best effort; unknown handles are ignored.
     *
     * @throws SubscriptionException if the source failed to release the subscription
     */
    void unsubscribe(SubscriptionHandle handle);
}

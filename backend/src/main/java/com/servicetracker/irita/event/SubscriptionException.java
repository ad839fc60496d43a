package com.servicetracker.irita.event;

/**
 * Thrown when a subscription cannot be opened or closed.
 */
public class SubscriptionException extends RuntimeException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.servicetracker.subscription;

/**
 * Thrown by {@link SubscriptionTracker#start()} when the tracker is already running.
 */
public class TrackerAlreadyStartedException extends RuntimeException {

    public TrackerAlreadyStartedException(String message) {
        super(message);
    }
}

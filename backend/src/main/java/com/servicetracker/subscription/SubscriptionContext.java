package com.servicetracker.subscription;

import com.servicetracker.irita.event.EventSource;
import com.servicetracker.irita.event.SubscriptionException;
import com.servicetracker.irita.event.SubscriptionHandle;
import com.servicetracker.run.RequestMemory;
import com.servicetracker.run.RunTrigger;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Collaborators and tuning shared by every {@link SubscriptionWorker}.
 */
@Slf4j
@Getter
@Builder
public class SubscriptionContext {

    private final EventSource eventSource;
    private final EventMatcher eventMatcher;
    private final RequestResolver requestResolver;
    private final RunTrigger runTrigger;
    private final RequestMemory requestMemory;
    private final SubscriptionRegistry registry;
    @Builder.Default
    private final Clock clock = Clock.systemUTC();
    /** Resolved requests buffered per worker before block delivery blocks. */
    @Builder.Default
    private final int inboxCapacity = 16;
    /** Longest a worker waits on its inbox before re-checking cancellation. */
    @Builder.Default
    private final long pollIntervalMs = 200L;

    /**
     * Unsubscribes, logging instead of propagating failures.
     */
    public void unsubscribeQuietly(SubscriptionHandle handle) {
        if (handle == null) {
            return;
        }
        try {
            eventSource.unsubscribe(handle);
        } catch (SubscriptionException e) {
            log.warn("Unsubscribe of {} failed: {}", handle.id(), e.getMessage());
        }
    }
}

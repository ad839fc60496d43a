package com.servicetracker.subscription;

import com.servicetracker.irita.event.SubscriptionException;
import com.servicetracker.subscription.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the tracker once the application is ready and stops it when the context closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackerLifecycle {

    private final SubscriptionTracker tracker;
    private final TrackerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!properties.isAutoStart()) {
            log.info("Subscription tracker auto-start disabled");
            return;
        }
        try {
            tracker.start();
        } catch (TrackerAlreadyStartedException e) {
            log.debug("Subscription tracker already running");
        } catch (SubscriptionException e) {
            // partial start: healthy jobs keep their workers
            log.error("Subscription tracker started with failures: {}", e.getMessage());
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed(ContextClosedEvent event) {
        tracker.stop();
    }
}

package com.servicetracker.subscription.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Subscription tracker tuning.
 */
@ConfigurationProperties(prefix = "servicetracker.tracker")
@NoArgsConstructor
@Getter
@Setter
public class TrackerProperties {

    /** Start the tracker when the application is ready. */
    private boolean autoStart = true;

    /** Resolved requests buffered per worker; a full inbox stalls that subscription's block delivery. */
    private int inboxCapacity = 16;

    /** How often an idle worker re-checks for shutdown or removal. */
    private long shutdownPollIntervalMs = 200;
}

package com.servicetracker.subscription.store;

import com.servicetracker.domain.InitiatorType;
import com.servicetracker.domain.JobSpec;

import java.util.function.Predicate;

/**
 * Read access to stored jobs for the tracker.
 */
public interface JobStore {

    /**
     * Visits every job that has an initiator of {@code type}. Enumeration stops when the visitor returns false.
     */
    void forEachJob(Predicate<JobSpec> visitor, InitiatorType type);
}

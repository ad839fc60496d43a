package com.servicetracker.subscription;

import com.servicetracker.domain.Interest;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live subscriptions by job id, at most one per (job, interest).
 * <p>
 * Thread-safe: every mutation takes the write lock of a single {@link ReentrantReadWriteLock},
 * reads take the read lock. Callers never hold the lock; event-source calls (unsubscribe) happen
 * outside it and are the caller's job for any entry this registry hands back.
 * The gauge {@value #GAUGE_NAME} tracks {@link #size()} and is updated on every mutation.
 */
@Component
public class SubscriptionRegistry {

    public static final String GAUGE_NAME = "service_tracker.job_subscriptions";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<Interest, RegisteredSubscription>> byJob = new HashMap<>();
    private final AtomicInteger liveJobs = new AtomicInteger();

    public SubscriptionRegistry(MeterRegistry meterRegistry) {
        Gauge.builder(GAUGE_NAME, liveJobs, AtomicInteger::get)
                .description("Jobs with at least one live event subscription")
                .register(meterRegistry);
    }

    /**
     * Inserts or replaces the entry for (jobId, interest).
     *
     * @return the displaced entry, which the caller must cancel and unsubscribe
     */
    public Optional<RegisteredSubscription> register(RegisteredSubscription subscription) {
        lock.writeLock().lock();
        try {
            RegisteredSubscription displaced = byJob
                    .computeIfAbsent(subscription.jobId(), k -> new HashMap<>())
                    .put(subscription.interest(), subscription);
            liveJobs.set(byJob.size());
            return displaced == subscription ? Optional.empty() : Optional.ofNullable(displaced);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Atomically removes every subscription of the job.
     *
     * @return removed entries; the caller unsubscribes them
     * @throws JobNotFoundException if the job has no entry
     */
    public List<RegisteredSubscription> remove(String jobId) {
        Map<Interest, RegisteredSubscription> removed;
        lock.writeLock().lock();
        try {
            removed = byJob.remove(jobId);
            liveJobs.set(byJob.size());
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new JobNotFoundException(jobId);
        }
        return List.copyOf(removed.values());
    }

    /**
     * Removes this exact entry if it is still the registered one for its (job, interest).
     *
     * @return true if removed; the caller then owns unsubscribing it
     */
    public boolean remove(RegisteredSubscription subscription) {
        lock.writeLock().lock();
        try {
            Map<Interest, RegisteredSubscription> entries = byJob.get(subscription.jobId());
            if (entries == null || entries.get(subscription.interest()) != subscription) {
                return false;
            }
            entries.remove(subscription.interest());
            if (entries.isEmpty()) {
                byJob.remove(subscription.jobId());
            }
            liveJobs.set(byJob.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of jobs with at least one live subscription. */
    public int size() {
        lock.readLock().lock();
        try {
            return byJob.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of live subscriptions across all jobs. */
    public int subscriptionCount() {
        lock.readLock().lock();
        try {
            return byJob.values().stream().mapToInt(Map::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String jobId) {
        lock.readLock().lock();
        try {
            return byJob.containsKey(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RegisteredSubscription> find(String jobId, Interest interest) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byJob.getOrDefault(jobId, Map.of()).get(interest));
        } finally {
            lock.readLock().unlock();
        }
    }
}

package com.servicetracker.subscription;

import com.servicetracker.common.CancellationToken;
import com.servicetracker.config.AsyncConfig;
import com.servicetracker.domain.Initiator;
import com.servicetracker.domain.InitiatorType;
import com.servicetracker.domain.Interest;
import com.servicetracker.domain.JobSpec;
import com.servicetracker.irita.event.SubscriptionException;
import com.servicetracker.subscription.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lifecycle of all IRITA_LOG job subscriptions: one {@link SubscriptionWorker} per (job, interest).
 * <p>
 * The started flag is guarded by a read/write lock that is never held across event-source calls.
 * Each start creates a fresh shutdown token; {@link #stop()} cancels it, which every worker observes
 * through its child token.
 */
@Slf4j
@Component
public class SubscriptionTracker {

    private final ReentrantReadWriteLock startedLock = new ReentrantReadWriteLock();
    private boolean started;
    private CancellationToken shutdown;

    private final JobStore jobStore;
    private final SubscriptionContext context;
    private final Executor workerExecutor;

    public SubscriptionTracker(JobStore jobStore,
                               SubscriptionContext context,
                               @Qualifier(AsyncConfig.SUBSCRIPTION_WORKER_EXECUTOR) Executor workerExecutor) {
        this.jobStore = jobStore;
        this.context = context;
        this.workerExecutor = workerExecutor;
    }

    /**
     * Starts tracking every stored IRITA_LOG job.
     *
     * @throws TrackerAlreadyStartedException if already started
     * @throws SubscriptionException          if some jobs could not subscribe; the tracker stays started
     *                                        and every other job keeps its workers
     */
    public void start() {
        startedLock.writeLock().lock();
        try {
            if (started) {
                throw new TrackerAlreadyStartedException("Subscription tracker already started");
            }
            shutdown = CancellationToken.create();
            started = true;
        } finally {
            startedLock.writeLock().unlock();
        }
        log.info("Subscription tracker started");

        List<SubscriptionException> failures = new ArrayList<>();
        int[] jobs = {0};
        jobStore.forEachJob(job -> {
            try {
                addJob(job);
            } catch (SubscriptionException e) {
                failures.add(e);
            }
            jobs[0]++;
            return true;
        }, InitiatorType.IRITA_LOG);
        log.info("Loaded {} IRITA_LOG job(s), {} subscription(s) live", jobs[0], context.getRegistry().subscriptionCount());
        throwIfAny(failures, "job(s) failed to subscribe on start");
    }

    /**
     * Signals every worker to stop. No-op when not started.
     */
    public void stop() {
        startedLock.writeLock().lock();
        try {
            if (!started) {
                return;
            }
            shutdown.cancel();
            started = false;
        } finally {
            startedLock.writeLock().unlock();
        }
        log.info("Subscription tracker stopped");
    }

    /**
     * Spawns one worker per IRITA_LOG initiator of the job. No-op when not started.
     *
     * @return number of workers spawned
     * @throws SubscriptionException if one or more interests could not subscribe; the others keep running
     */
    public int addJob(JobSpec job) {
        CancellationToken parent;
        startedLock.readLock().lock();
        try {
            if (!started) {
                log.debug("Tracker not started, ignoring job {}", job.getId());
                return 0;
            }
            parent = shutdown;
        } finally {
            startedLock.readLock().unlock();
        }

        int spawned = 0;
        List<SubscriptionException> failures = new ArrayList<>();
        for (Initiator initiator : job.initiatorsFor(InitiatorType.IRITA_LOG)) {
            if (isBlank(initiator.getServiceProvider()) || isBlank(initiator.getServiceName())) {
                failures.add(new SubscriptionException("Job " + job.getId() + " has an IRITA_LOG initiator without provider or service name"));
                continue;
            }
            SubscriptionWorker worker = new SubscriptionWorker(job, Interest.of(initiator), context, parent.child());
            try {
                worker.open();
            } catch (SubscriptionException e) {
                log.error("Job {} could not subscribe for {}: {}", job.getId(), worker.interest(), e.getMessage());
                failures.add(e);
                continue;
            }
            try {
                workerExecutor.execute(worker::run);
                spawned++;
            } catch (RejectedExecutionException e) {
                worker.abort();
                failures.add(new SubscriptionException("No worker thread for job " + job.getId() + " (" + worker.interest() + ")", e));
            }
        }
        throwIfAny(failures, "subscription(s) failed for job " + job.getId());
        return spawned;
    }

    /**
     * Stops every worker of the job and closes its subscriptions.
     *
     * @throws JobNotFoundException if the job has no live subscription
     */
    public void removeJob(String jobId) {
        List<RegisteredSubscription> removed = context.getRegistry().remove(jobId);
        for (RegisteredSubscription subscription : removed) {
            subscription.token().cancel();
            context.unsubscribeQuietly(subscription.handle());
        }
        log.info("Removed job {} ({} subscription(s))", jobId, removed.size());
    }

    public boolean isStarted() {
        startedLock.readLock().lock();
        try {
            return started;
        } finally {
            startedLock.readLock().unlock();
        }
    }

    /** Jobs with at least one live subscription. */
    public int jobCount() {
        return context.getRegistry().size();
    }

    public int subscriptionCount() {
        return context.getRegistry().subscriptionCount();
    }

    private static void throwIfAny(List<SubscriptionException> failures, String summary) {
        if (failures.isEmpty()) {
            return;
        }
        SubscriptionException first = failures.get(0);
        SubscriptionException aggregate = new SubscriptionException(
                failures.size() + " " + summary + ": " + first.getMessage(), first);
        failures.stream().skip(1).forEach(aggregate::addSuppressed);
        throw aggregate;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

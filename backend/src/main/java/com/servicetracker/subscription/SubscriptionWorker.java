package com.servicetracker.subscription;

import com.servicetracker.common.CancellationToken;
import com.servicetracker.domain.Interest;
import com.servicetracker.domain.JobSpec;
import com.servicetracker.domain.ResolvedRequest;
import com.servicetracker.domain.RunRequest;
import com.servicetracker.irita.event.Block;
import com.servicetracker.irita.event.SubscriptionException;
import com.servicetracker.irita.event.SubscriptionHandle;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Subscription for one (job, interest): turns matching blocks into resolved requests and triggers a run per request.
 * <p>
 * {@link #open()} runs on the caller's thread and registers the subscription; {@link #run()} is the long-lived
 * loop. The loop ends when the token is cancelled (shutdown, job removal, displacement) or when a request arrives
 * outside the job's activity window. On exit the worker deregisters itself and unsubscribes, unless another party
 * already removed its registry entry (that party unsubscribes).
 */
@Slf4j
public class SubscriptionWorker {

    private final JobSpec job;
    private final Interest interest;
    private final SubscriptionContext context;
    private final CancellationToken token;
    private final BlockingQueue<ResolvedRequest> inbox;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.INITIALIZING);
    private volatile RegisteredSubscription registration;

    public SubscriptionWorker(JobSpec job, Interest interest, SubscriptionContext context, CancellationToken token) {
        this.job = job;
        this.interest = interest;
        this.context = context;
        this.token = token;
        this.inbox = new ArrayBlockingQueue<>(Math.max(1, context.getInboxCapacity()));
    }

    /**
     * Opens the subscription and registers it.
     *
     * @throws SubscriptionException if the event source refuses the subscription; nothing is registered
     */
    public void open() {
        if (state.get() != WorkerState.INITIALIZING) {
            throw new IllegalStateException("Worker for job " + job.getId() + " already opened");
        }
        SubscriptionHandle handle;
        try {
            handle = context.getEventSource().subscribe(EventMatcher.queryFor(interest), this::onBlock);
        } catch (RuntimeException e) {
            state.set(WorkerState.STOPPED);
            if (e instanceof SubscriptionException se) {
                throw se;
            }
            throw new SubscriptionException("Subscribe failed for job " + job.getId() + " (" + interest + ")", e);
        }
        RegisteredSubscription entry = new RegisteredSubscription(job.getId(), interest, handle, token);
        registration = entry;
        context.getRegistry().register(entry).ifPresent(displaced -> {
            log.info("Replacing subscription {} of job {} ({})", displaced.handle().id(), job.getId(), interest);
            displaced.token().cancel();
            context.unsubscribeQuietly(displaced.handle());
        });
        state.compareAndSet(WorkerState.INITIALIZING, WorkerState.RUNNING);
        log.info("Worker for job {} ({}) subscribed as {}", job.getId(), interest, handle.id());
    }

    /**
     * Worker loop. Returns when the worker stops.
     */
    public void run() {
        if (state.get() != WorkerState.RUNNING) {
            log.warn("Worker for job {} ({}) not running (state {}), loop not started", job.getId(), interest, state.get());
            return;
        }
        try {
            while (!token.isCancelled()) {
                ResolvedRequest request;
                try {
                    request = inbox.poll(context.getPollIntervalMs(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (request == null || token.isCancelled()) {
                    continue;
                }
                Instant now = context.getClock().instant();
                if (!job.isActive(now)) {
                    log.info("Job {} outside its activity window at {}, stopping worker ({})", job.getId(), now, interest);
                    break;
                }
                trigger(request);
            }
        } finally {
            drain();
        }
    }

    /**
     * Stops a worker whose loop never started.
     */
    void abort() {
        token.cancel();
        drain();
    }

    public WorkerState state() {
        return state.get();
    }

    public Interest interest() {
        return interest;
    }

    void onBlock(Block block) {
        if (!isAccepting()) {
            return;
        }
        Set<String> requestIds = context.getEventMatcher().match(block.endBlockEvents(), interest);
        if (requestIds.isEmpty()) {
            return;
        }
        log.debug("Block {}: {} request(s) for job {} ({})", block.height(), requestIds.size(), job.getId(), interest);
        List<ResolvedRequest> resolved = context.getRequestResolver().resolve(requestIds, interest);
        for (ResolvedRequest request : resolved) {
            if (!offer(request)) {
                log.debug("Worker for job {} stopped, dropping request {}", job.getId(), request.request().id());
                return;
            }
        }
    }

    private boolean offer(ResolvedRequest request) {
        try {
            while (isAccepting()) {
                if (inbox.offer(request, context.getPollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private boolean isAccepting() {
        WorkerState current = state.get();
        return (current == WorkerState.INITIALIZING || current == WorkerState.RUNNING) && !token.isCancelled();
    }

    private void trigger(ResolvedRequest request) {
        String runId;
        try {
            runId = context.getRunTrigger().create(job.getId(), interest, null, RunRequest.empty());
        } catch (RuntimeException e) {
            log.error("Run trigger failed for job {} request {}: {}", job.getId(), request.request().id(), e.getMessage(), e);
            return;
        }
        context.getRequestMemory().put(runId, request);
        log.info("Triggered run {} of job {} for request {}", runId, job.getId(), request.request().id());
    }

    private void drain() {
        WorkerState previous = state.getAndSet(WorkerState.DRAINING);
        if (previous == WorkerState.STOPPED) {
            state.set(WorkerState.STOPPED);
            return;
        }
        token.cancel();
        inbox.clear();
        RegisteredSubscription entry = registration;
        if (entry != null && context.getRegistry().remove(entry)) {
            context.unsubscribeQuietly(entry.handle());
        }
        state.set(WorkerState.STOPPED);
        log.info("Worker for job {} ({}) stopped", job.getId(), interest);
    }
}

package com.servicetracker.common;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal observable by any number of threads.
 * A child token reports cancelled when either it or any ancestor has been cancelled.
 * Cancelling is idempotent; a token is never re-armed.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * New token that is cancelled together with this one but can also be cancelled on its own.
     */
    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /**
     * @return true if this call performed the cancellation, false if it was already cancelled
     */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    /**
     * Waits up to {@code timeout} for cancellation. Returns true if cancelled.
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        if (parent == null) {
            return latch.await(timeout, unit) || isCancelled();
        }
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        long step = TimeUnit.MILLISECONDS.toNanos(50);
        while (!isCancelled()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            latch.await(Math.min(step, remaining), TimeUnit.NANOSECONDS);
        }
        return true;
    }
}

package com.delta.scraper.scrape.job;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by one job's workers. Every wait a worker performs goes through
 * {@link #sleep} so a cancel wakes it immediately. Threads registered here are interrupted only if the
 * job overstays its grace period.
 */
public final class CancellationSignal {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException("cancelled");
        }
    }

    public void sleep(long millis) {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            if (cancelled.await(millis, TimeUnit.MILLISECONDS)) {
                throw new JobCancelledException("cancelled during wait");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("interrupted during wait");
        }
    }

    public void register(Thread thread) {
        workers.add(thread);
    }

    public void unregister(Thread thread) {
        workers.remove(thread);
    }

    int interruptWorkers() {
        int count = 0;
        for (Thread worker : workers) {
            worker.interrupt();
            count++;
        }
        return count;
    }
}

package com.bko.glucosesync.sync.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs only the last of a burst of submissions, once no new submission arrived for the quiet period.
 */
public class Debouncer {
    private static final Logger logger = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService scheduler;
    private final Duration quietPeriod;
    private ScheduledFuture<?> pending;

    public Debouncer(ScheduledExecutorService scheduler, Duration quietPeriod) {
        this.scheduler = scheduler;
        this.quietPeriod = quietPeriod;
    }

    public synchronized void submit(Runnable task) {
        if (pending != null && !pending.isDone()) {
            pending.cancel(false);
            logger.debug("Replaced pending debounced task.");
        }
        pending = scheduler.schedule(task, quietPeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }
}

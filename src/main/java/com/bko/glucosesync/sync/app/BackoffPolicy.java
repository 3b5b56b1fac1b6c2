package com.bko.glucosesync.sync.app;

import java.time.Duration;

/**
 * Wait before the next cycle: {@code baseInterval * min(consecutiveErrors + 1, maxMultiplier)}.
 */
public class BackoffPolicy {
    private final Duration baseInterval;
    private final int maxMultiplier;

    public BackoffPolicy(Duration baseInterval, int maxMultiplier) {
        this.baseInterval = baseInterval;
        this.maxMultiplier = Math.max(1, maxMultiplier);
    }

    public Duration delayAfter(int consecutiveErrors) {
        int multiplier = Math.min(Math.max(0, consecutiveErrors) + 1, maxMultiplier);
        return baseInterval.multipliedBy(multiplier);
    }

    public Duration baseInterval() {
        return baseInterval;
    }
}

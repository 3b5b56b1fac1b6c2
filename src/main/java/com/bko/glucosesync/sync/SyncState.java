package com.bko.glucosesync.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the sync loop. {@code running} is true while the loop is active, not only while a cycle executes.
 */
public record SyncState(
        Instant lastSuccessfulSync,
        int consecutiveErrorCount,
        boolean running,
        Instant runStartedAt,
        Duration nextSyncDelay
) {
}

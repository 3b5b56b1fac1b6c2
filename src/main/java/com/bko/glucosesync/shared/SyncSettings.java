package com.bko.glucosesync.shared;

import java.time.Duration;

public record SyncSettings(
        Duration baseInterval,
        int maxBackoffMultiplier,
        int maxConsecutiveErrors,
        Duration maxActiveDuration,
        Duration debounceQuietPeriod,
        Duration officialLookback,
        Duration shareLookback,
        String connectivityProbeHost
) {
    public static SyncSettings defaults() {
        return new SyncSettings(
                Duration.ofMinutes(5),
                4,
                3,
                Duration.ofMinutes(30),
                Duration.ofSeconds(2),
                Duration.ofHours(24),
                Duration.ofHours(3).plusMinutes(15),
                "api.dexcom.eu"
        );
    }
}

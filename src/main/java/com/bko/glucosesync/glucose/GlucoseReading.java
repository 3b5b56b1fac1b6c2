package com.bko.glucosesync.glucose;

import java.time.Instant;
import java.util.Objects;

/**
 * One sensor value in mg/dL.
 */
public record GlucoseReading(
        int value,
        Instant timestamp,
        TrendDirection trend,
        ReadingSource source,
        String deviceLabel
) {
    public GlucoseReading {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
        if (trend == null) {
            trend = TrendDirection.UNKNOWN;
        }
    }

    public GlucoseReading(int value, Instant timestamp, ReadingSource source) {
        this(value, timestamp, TrendDirection.UNKNOWN, source, null);
    }
}

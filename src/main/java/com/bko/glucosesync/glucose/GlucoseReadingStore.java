package com.bko.glucosesync.glucose;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for glucose readings. Implementations must be safe for concurrent use; range bounds are inclusive and
 * a {@code null} source matches every source.
 */
public interface GlucoseReadingStore {
    boolean existsWithin(ReadingSource source, Instant from, Instant to) throws IOException;

    List<GlucoseReading> findBetween(Instant from, Instant to, ReadingSource source) throws IOException;

    GlucoseReading insert(GlucoseReading reading) throws IOException;

    void insertAll(List<GlucoseReading> readings) throws IOException;

    Optional<GlucoseReading> findLatest(ReadingSource source) throws IOException;

    long count() throws IOException;

    int deleteBefore(Instant before) throws IOException;

    int deleteBySource(ReadingSource source) throws IOException;
}

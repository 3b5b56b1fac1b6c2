package com.bko.glucosesync.glucose;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryGlucoseReadingStore implements GlucoseReadingStore {
    private final List<GlucoseReading> readings = new ArrayList<>();

    @Override
    public synchronized boolean existsWithin(ReadingSource source, Instant from, Instant to) {
        return readings.stream().anyMatch(r -> matches(r, source) && inRange(r, from, to));
    }

    @Override
    public synchronized List<GlucoseReading> findBetween(Instant from, Instant to, ReadingSource source) {
        List<GlucoseReading> result = new ArrayList<>();
        for (GlucoseReading reading : readings) {
            if (matches(reading, source) && inRange(reading, from, to)) {
                result.add(reading);
            }
        }
        result.sort(Comparator.comparing(GlucoseReading::timestamp).reversed());
        return result;
    }

    @Override
    public synchronized GlucoseReading insert(GlucoseReading reading) {
        readings.add(reading);
        return reading;
    }

    @Override
    public synchronized void insertAll(List<GlucoseReading> batch) {
        readings.addAll(batch);
    }

    @Override
    public synchronized Optional<GlucoseReading> findLatest(ReadingSource source) {
        return readings.stream()
                .filter(r -> matches(r, source))
                .max(Comparator.comparing(GlucoseReading::timestamp));
    }

    @Override
    public synchronized long count() {
        return readings.size();
    }

    @Override
    public synchronized int deleteBefore(Instant before) {
        int size = readings.size();
        readings.removeIf(r -> r.timestamp().isBefore(before));
        return size - readings.size();
    }

    @Override
    public synchronized int deleteBySource(ReadingSource source) {
        int size = readings.size();
        readings.removeIf(r -> r.source() == source);
        return size - readings.size();
    }

    private boolean matches(GlucoseReading reading, ReadingSource source) {
        return source == null || reading.source() == source;
    }

    private boolean inRange(GlucoseReading reading, Instant from, Instant to) {
        return !reading.timestamp().isBefore(from) && !reading.timestamp().isAfter(to);
    }
}

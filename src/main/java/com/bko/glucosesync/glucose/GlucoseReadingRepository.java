package com.bko.glucosesync.glucose;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Validating, deduplicating front of the {@link GlucoseReadingStore}. Two readings of the same source less than
 * a second apart are the same reading.
 */
@Service
public class GlucoseReadingRepository {
    private static final Logger logger = LoggerFactory.getLogger(GlucoseReadingRepository.class);
    public static final int MIN_VALUE = 40;
    public static final int MAX_VALUE = 400;
    static final Duration DUPLICATE_WINDOW = Duration.ofSeconds(1);

    private final GlucoseReadingStore store;
    private final Clock clock;

    public GlucoseReadingRepository(GlucoseReadingStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean isValid(GlucoseReading reading) {
        return reading.value() >= MIN_VALUE
                && reading.value() <= MAX_VALUE
                && !reading.timestamp().isAfter(clock.instant());
    }

    /**
     * @return the stored reading, or empty when it was invalid or already stored
     */
    public Optional<GlucoseReading> saveReading(GlucoseReading reading) throws GlucoseApiException {
        if (!isValid(reading)) {
            logger.debug("Rejected reading {} at {}", reading.value(), reading.timestamp());
            return Optional.empty();
        }
        try {
            Instant ts = reading.timestamp();
            if (store.existsWithin(reading.source(), ts.minus(DUPLICATE_WINDOW), ts.plus(DUPLICATE_WINDOW))) {
                return Optional.empty();
            }
            return Optional.of(store.insert(reading));
        } catch (IOException e) {
            throw storageFailure("save reading", e);
        }
    }

    /**
     * Saves the valid, previously unseen readings of a batch using one range query for the duplicate check.
     *
     * @return number of readings inserted
     */
    public int saveReadings(List<GlucoseReading> batch) throws GlucoseApiException {
        List<GlucoseReading> candidates = new ArrayList<>();
        Instant earliest = null;
        Instant latest = null;
        for (GlucoseReading reading : batch) {
            if (!isValid(reading)) {
                continue;
            }
            candidates.add(reading);
            Instant ts = reading.timestamp();
            earliest = earliest == null || ts.isBefore(earliest) ? ts : earliest;
            latest = latest == null || ts.isAfter(latest) ? ts : latest;
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        try {
            Map<ReadingSource, NavigableSet<Instant>> known = new EnumMap<>(ReadingSource.class);
            for (GlucoseReading existing : store.findBetween(earliest.minus(DUPLICATE_WINDOW),
                    latest.plus(DUPLICATE_WINDOW), null)) {
                known.computeIfAbsent(existing.source(), s -> new TreeSet<>()).add(existing.timestamp());
            }

            List<GlucoseReading> accepted = new ArrayList<>();
            for (GlucoseReading reading : candidates) {
                NavigableSet<Instant> seen = known.computeIfAbsent(reading.source(), s -> new TreeSet<>());
                if (hasNeighbour(seen, reading.timestamp())) {
                    continue;
                }
                seen.add(reading.timestamp());
                accepted.add(reading);
            }

            if (!accepted.isEmpty()) {
                store.insertAll(accepted);
            }
            logger.debug("Saved {} of {} readings ({} invalid or duplicate)",
                    accepted.size(), batch.size(), batch.size() - accepted.size());
            return accepted.size();
        } catch (IOException e) {
            throw storageFailure("save readings", e);
        }
    }

    private boolean hasNeighbour(NavigableSet<Instant> seen, Instant ts) {
        Instant floor = seen.floor(ts);
        if (floor != null && !floor.plus(DUPLICATE_WINDOW).isBefore(ts)) {
            return true;
        }
        Instant ceiling = seen.ceiling(ts);
        return ceiling != null && !ceiling.minus(DUPLICATE_WINDOW).isAfter(ts);
    }

    public List<GlucoseReading> fetchReadings(Instant start, Instant end, ReadingSource source)
            throws GlucoseApiException {
        try {
            return store.findBetween(start, end, source);
        } catch (IOException e) {
            throw storageFailure("fetch readings", e);
        }
    }

    public Optional<GlucoseReading> fetchLatestReading(ReadingSource source) throws GlucoseApiException {
        try {
            return store.findLatest(source);
        } catch (IOException e) {
            throw storageFailure("fetch latest reading", e);
        }
    }

    public long countReadings() throws GlucoseApiException {
        try {
            return store.count();
        } catch (IOException e) {
            throw storageFailure("count readings", e);
        }
    }

    public int deleteOldReadings(Instant before) throws GlucoseApiException {
        try {
            int deleted = store.deleteBefore(before);
            logger.info("Deleted {} readings older than {}", deleted, before);
            return deleted;
        } catch (IOException e) {
            throw storageFailure("delete old readings", e);
        }
    }

    public int deleteReadings(ReadingSource source) throws GlucoseApiException {
        try {
            int deleted = store.deleteBySource(source);
            logger.info("Deleted {} {} readings", deleted, source.tag());
            return deleted;
        } catch (IOException e) {
            throw storageFailure("delete readings", e);
        }
    }

    private GlucoseApiException storageFailure(String operation, IOException e) {
        if (e instanceof GlucoseApiException && ((GlucoseApiException) e).getKind() == ErrorKind.STORAGE_FAILURE) {
            return (GlucoseApiException) e;
        }
        logger.error("Failed to {}: {}", operation, e.getMessage());
        return new GlucoseApiException(ErrorKind.STORAGE_FAILURE, "Failed to " + operation, e);
    }
}

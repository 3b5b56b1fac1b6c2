package com.bko.glucosesync.glucose;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Serves a time range from two upstreams split at {@code now - (regulatedDelay + safetyBuffer)}: the official API
 * covers everything older than the split point and Share covers the rest.
 */
public class HybridGlucoseSource implements GlucoseDataSource {
    private static final Logger logger = LoggerFactory.getLogger(HybridGlucoseSource.class);

    private final GlucoseDataSource official;
    private final GlucoseDataSource share;
    private final Executor executor;
    private final Clock clock;
    private final Duration regulatedDelay;
    private final Duration safetyBuffer;

    public HybridGlucoseSource(GlucoseDataSource official,
                               GlucoseDataSource share,
                               Executor executor,
                               Clock clock,
                               Duration regulatedDelay,
                               Duration safetyBuffer) {
        this.official = official;
        this.share = share;
        this.executor = executor;
        this.clock = clock;
        this.regulatedDelay = regulatedDelay;
        this.safetyBuffer = safetyBuffer;
    }

    public Instant splitPoint() {
        return clock.instant().minus(regulatedDelay.plus(safetyBuffer));
    }

    @Override
    public List<GlucoseReading> fetchReadings(Instant start, Instant end) throws IOException {
        if (start.isAfter(end)) {
            throw new GlucoseApiException(ErrorKind.INVALID_DATE_RANGE,
                    "Start " + start + " is after end " + end);
        }
        Instant split = splitPoint();
        boolean needsOfficial = start.isBefore(split);
        boolean needsShare = end.isAfter(split);

        CompletableFuture<Outcome> officialFuture = null;
        CompletableFuture<Outcome> shareFuture = null;
        if (needsOfficial) {
            Instant officialEnd = end.isBefore(split) ? end : split;
            officialFuture = fetchAsync(official, start, officialEnd);
        }
        if (needsShare) {
            Instant shareStart = start.isAfter(split) ? start : split;
            shareFuture = fetchAsync(share, shareStart, end);
        }

        Outcome officialOutcome = officialFuture != null ? await(officialFuture) : null;
        Outcome shareOutcome = shareFuture != null ? await(shareFuture) : null;
        return merge(officialOutcome, shareOutcome);
    }

    private List<GlucoseReading> merge(Outcome officialOutcome, Outcome shareOutcome) throws IOException {
        List<GlucoseReading> collected = new ArrayList<>();

        if (officialOutcome != null) {
            if (officialOutcome.failed()) {
                if (shareOutcome == null) {
                    throw officialOutcome.error();
                }
                logger.warn("Official glucose fetch failed, continuing with Share only: {}",
                        officialOutcome.error().getMessage());
            } else {
                collected.addAll(officialOutcome.readings());
            }
        }

        if (shareOutcome != null) {
            if (shareOutcome.failed()) {
                if (collected.isEmpty()) {
                    IOException error = shareOutcome.error();
                    if (officialOutcome != null && officialOutcome.failed()) {
                        error.addSuppressed(officialOutcome.error());
                    }
                    throw error;
                }
                logger.warn("Share glucose fetch failed, returning {} official readings: {}",
                        collected.size(), shareOutcome.error().getMessage());
            } else {
                collected.addAll(shareOutcome.readings());
            }
        }

        return deduplicate(collected);
    }

    /**
     * Keeps the first reading per (epoch second, value) and orders newest first.
     */
    static List<GlucoseReading> deduplicate(List<GlucoseReading> readings) {
        Map<String, GlucoseReading> unique = new LinkedHashMap<>();
        for (GlucoseReading reading : readings) {
            unique.putIfAbsent(reading.timestamp().getEpochSecond() + "_" + reading.value(), reading);
        }
        List<GlucoseReading> result = new ArrayList<>(unique.values());
        result.sort(Comparator.comparing(GlucoseReading::timestamp).reversed());
        return result;
    }

    @Override
    public Optional<GlucoseReading> fetchLatestReading() throws IOException {
        boolean officialAvailable = official.isAvailable();
        if (share.isAvailable()) {
            try {
                Optional<GlucoseReading> latest = share.fetchLatestReading();
                if (latest.isPresent() || !officialAvailable) {
                    return latest;
                }
            } catch (IOException e) {
                if (!officialAvailable) {
                    throw e;
                }
                logger.warn("Share latest reading failed, falling back to official API: {}", e.getMessage());
            }
        }
        if (officialAvailable) {
            return official.fetchLatestReading();
        }
        throw new GlucoseApiException(ErrorKind.NOT_CONNECTED, "No glucose source is connected");
    }

    @Override
    public boolean isAvailable() {
        return official.isAvailable() || share.isAvailable();
    }

    @Override
    public DataSourceInfo sourceInfo() {
        return new DataSourceInfo(
                "Hybrid",
                "hybrid",
                Duration.ZERO,
                "Share for the most recent " + regulatedDelay.plus(safetyBuffer).toMinutes()
                        + " minutes, official API for older data"
        );
    }

    private CompletableFuture<Outcome> fetchAsync(GlucoseDataSource source, Instant start, Instant end) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Outcome.success(source.fetchReadings(start, end));
            } catch (GlucoseApiException e) {
                if (e.isNoData()) {
                    return Outcome.success(List.of());
                }
                return Outcome.failure(e);
            } catch (IOException e) {
                return Outcome.failure(e);
            }
        }, executor);
    }

    private Outcome await(CompletableFuture<Outcome> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new GlucoseApiException(ErrorKind.CANCELLED, "Interrupted while fetching glucose readings", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Glucose fetch failed", cause);
        }
    }

    private record Outcome(List<GlucoseReading> readings, IOException error) {
        static Outcome success(List<GlucoseReading> readings) {
            return new Outcome(readings, null);
        }

        static Outcome failure(IOException error) {
            return new Outcome(List.of(), error);
        }

        boolean failed() {
            return error != null;
        }
    }
}

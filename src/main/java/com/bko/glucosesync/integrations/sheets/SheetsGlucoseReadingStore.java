package com.bko.glucosesync.integrations.sheets;

import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.GlucoseReadingStore;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.glucose.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keeps readings in the "Glucose Readings" sheet, one row per reading. Rows are loaded once and mirrored in memory.
 */
public class SheetsGlucoseReadingStore implements GlucoseReadingStore {
    private static final Logger logger = LoggerFactory.getLogger(SheetsGlucoseReadingStore.class);
    static final String SHEET_NAME = "Glucose Readings";
    static final String RANGE = SHEET_NAME + "!A:E";
    static final List<Object> HEADERS = List.of("Timestamp", "Value", "Trend", "Source", "Device");

    private final SpreadsheetPort spreadsheetPort;
    private List<GlucoseReading> rows;

    public SheetsGlucoseReadingStore(SpreadsheetPort spreadsheetPort) {
        this.spreadsheetPort = spreadsheetPort;
    }

    @Override
    public synchronized boolean existsWithin(ReadingSource source, Instant from, Instant to) throws IOException {
        return load().stream().anyMatch(r -> r.source() == source && inRange(r, from, to));
    }

    @Override
    public synchronized List<GlucoseReading> findBetween(Instant from, Instant to, ReadingSource source)
            throws IOException {
        List<GlucoseReading> result = new ArrayList<>();
        for (GlucoseReading reading : load()) {
            if ((source == null || reading.source() == source) && inRange(reading, from, to)) {
                result.add(reading);
            }
        }
        result.sort(Comparator.comparing(GlucoseReading::timestamp).reversed());
        return result;
    }

    @Override
    public synchronized GlucoseReading insert(GlucoseReading reading) throws IOException {
        insertAll(List.of(reading));
        return reading;
    }

    @Override
    public synchronized void insertAll(List<GlucoseReading> readings) throws IOException {
        List<GlucoseReading> current = load();
        List<List<Object>> values = new ArrayList<>();
        for (GlucoseReading reading : readings) {
            values.add(toRow(reading));
        }
        spreadsheetPort.appendRows(RANGE, values);
        current.addAll(readings);
        logger.info("Appended {} readings to {}.", readings.size(), SHEET_NAME);
    }

    @Override
    public synchronized Optional<GlucoseReading> findLatest(ReadingSource source) throws IOException {
        return load().stream()
                .filter(r -> source == null || r.source() == source)
                .max(Comparator.comparing(GlucoseReading::timestamp));
    }

    @Override
    public synchronized long count() throws IOException {
        return load().size();
    }

    @Override
    public synchronized int deleteBefore(Instant before) throws IOException {
        return rewriteWithout(r -> r.timestamp().isBefore(before));
    }

    @Override
    public synchronized int deleteBySource(ReadingSource source) throws IOException {
        return rewriteWithout(r -> r.source() == source);
    }

    private int rewriteWithout(Predicate<GlucoseReading> removed) throws IOException {
        List<GlucoseReading> current = load();
        List<GlucoseReading> kept = new ArrayList<>();
        for (GlucoseReading reading : current) {
            if (!removed.test(reading)) {
                kept.add(reading);
            }
        }
        int deleted = current.size() - kept.size();
        if (deleted == 0) {
            return 0;
        }
        List<List<Object>> values = new ArrayList<>();
        for (GlucoseReading reading : kept) {
            values.add(toRow(reading));
        }
        spreadsheetPort.rewriteRows(SHEET_NAME, values);
        rows = kept;
        return deleted;
    }

    private List<GlucoseReading> load() throws IOException {
        if (rows != null) {
            return rows;
        }
        spreadsheetPort.addSheetIfMissing(SHEET_NAME);
        spreadsheetPort.writeHeaderRow(SHEET_NAME, HEADERS);
        List<GlucoseReading> loaded = new ArrayList<>();
        List<List<Object>> values = spreadsheetPort.readRows(RANGE);
        for (int i = 1; i < values.size(); i++) {
            GlucoseReading reading = fromRow(values.get(i));
            if (reading != null) {
                loaded.add(reading);
            }
        }
        logger.info("Loaded {} readings from {}.", loaded.size(), SHEET_NAME);
        rows = loaded;
        return rows;
    }

    static List<Object> toRow(GlucoseReading reading) {
        List<Object> row = new ArrayList<>();
        row.add(reading.timestamp().toString());
        row.add(reading.value());
        row.add(reading.trend().upstreamName());
        row.add(reading.source().tag());
        row.add(reading.deviceLabel() != null ? reading.deviceLabel() : "");
        return row;
    }

    static GlucoseReading fromRow(List<Object> row) {
        if (row == null || row.size() < 4) {
            return null;
        }
        try {
            Instant timestamp = Instant.parse(row.get(0).toString());
            int value = (int) Double.parseDouble(row.get(1).toString());
            TrendDirection trend = TrendDirection.fromUpstream(row.get(2).toString());
            ReadingSource source = ReadingSource.fromTag(row.get(3).toString());
            String device = row.size() > 4 ? row.get(4).toString() : null;
            return new GlucoseReading(value, timestamp, trend, source, device);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            logger.debug("Skipping malformed row {}: {}", row, e.getMessage());
            return null;
        }
    }

    private boolean inRange(GlucoseReading reading, Instant from, Instant to) {
        return !reading.timestamp().isBefore(from) && !reading.timestamp().isAfter(to);
    }
}

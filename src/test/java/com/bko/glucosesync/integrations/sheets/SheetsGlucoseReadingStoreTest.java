package com.bko.glucosesync.integrations.sheets;

import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.glucose.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SheetsGlucoseReadingStoreTest {
    private static final Instant TS = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void loadsRowsOnceSkippingHeaderAndMalformedRows() throws Exception {
        SpreadsheetPort port = mock(SpreadsheetPort.class);
        when(port.readRows(SheetsGlucoseReadingStore.RANGE)).thenReturn(List.of(
                List.of("Timestamp", "Value", "Trend", "Source", "Device"),
                List.of("2024-05-01T10:00:00Z", "120", "Flat", "dexcomShare", "Dexcom Share"),
                List.of("not a date", "120", "Flat", "dexcomShare"),
                List.of("2024-05-01T09:55:00Z", "115", "SingleUp", "dexcomOfficial")
        ));
        SheetsGlucoseReadingStore store = new SheetsGlucoseReadingStore(port);

        assertEquals(2, store.count());
        assertEquals(1, store.findBetween(TS.minusSeconds(600), TS, ReadingSource.OFFICIAL).size());
        assertTrue(store.existsWithin(ReadingSource.SHARE, TS.minusSeconds(1), TS.plusSeconds(1)));

        verify(port, times(1)).addSheetIfMissing(SheetsGlucoseReadingStore.SHEET_NAME);
        verify(port, times(1)).writeHeaderRow(SheetsGlucoseReadingStore.SHEET_NAME, SheetsGlucoseReadingStore.HEADERS);
        verify(port, times(1)).readRows(SheetsGlucoseReadingStore.RANGE);
    }

    @Test
    void insertAppendsRows() throws Exception {
        SpreadsheetPort port = mock(SpreadsheetPort.class);
        when(port.readRows(SheetsGlucoseReadingStore.RANGE)).thenReturn(List.of());
        SheetsGlucoseReadingStore store = new SheetsGlucoseReadingStore(port);
        GlucoseReading reading = new GlucoseReading(130, TS, TrendDirection.FORTY_FIVE_UP, ReadingSource.SHARE, null);

        store.insertAll(List.of(reading));

        verify(port).appendRows(SheetsGlucoseReadingStore.RANGE,
                List.of(List.of("2024-05-01T10:00:00Z", 130, "FortyFiveUp", "dexcomShare", "")));
        assertEquals(reading, store.findLatest(null).orElseThrow());
    }

    @Test
    void deleteRewritesRemainingRows() throws Exception {
        SpreadsheetPort port = mock(SpreadsheetPort.class);
        when(port.readRows(SheetsGlucoseReadingStore.RANGE)).thenReturn(List.of(
                List.of("Timestamp", "Value", "Trend", "Source", "Device"),
                List.of("2024-05-01T10:00:00Z", "120", "Flat", "dexcomShare", "Dexcom Share"),
                List.of("2024-05-01T09:55:00Z", "115", "SingleUp", "dexcomOfficial", "G7")
        ));
        SheetsGlucoseReadingStore store = new SheetsGlucoseReadingStore(port);

        assertEquals(1, store.deleteBySource(ReadingSource.OFFICIAL));

        verify(port).rewriteRows(eq(SheetsGlucoseReadingStore.SHEET_NAME),
                eq(List.of(List.of("2024-05-01T10:00:00Z", 120, "Flat", "dexcomShare", "Dexcom Share"))));
        assertEquals(1, store.count());
    }

    @Test
    void fromRowRejectsShortRows() {
        assertNull(SheetsGlucoseReadingStore.fromRow(List.of("2024-05-01T10:00:00Z", "120")));
    }
}

package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DexcomTimestampParserTest {

    @Test
    void parsesOffsetAndFractionVariants() throws Exception {
        assertEquals(Instant.parse("2024-03-01T10:15:30.123Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15:30.123Z"));
        assertEquals(Instant.parse("2024-03-01T08:15:30Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15:30+02:00"));
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15Z"));
    }

    @Test
    void timestampsWithoutOffsetAreUtc() throws Exception {
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15:30"));
        assertEquals(Instant.parse("2024-03-01T10:15:30.500Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15:30.5"));
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"),
                DexcomTimestampParser.parse("2024-03-01T10:15"));
    }

    @Test
    void rejectsGarbage() {
        GlucoseApiException e = assertThrows(GlucoseApiException.class,
                () -> DexcomTimestampParser.parse("yesterday"));
        assertEquals(ErrorKind.DECODE_FAILURE, e.getKind());
    }

    @Test
    void formatsQueryTimestampsInUtcWithMillis() {
        assertEquals("2024-03-01T10:15:30.000",
                DexcomTimestampParser.formatForQuery(Instant.parse("2024-03-01T10:15:30Z")));
    }
}

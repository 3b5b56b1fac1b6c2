package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Dexcom timestamps come with or without fractional seconds, with or without an offset, and occasionally without
 * seconds at all. Values without an offset are UTC.
 */
public final class DexcomTimestampParser {
    private static final DateTimeFormatter QUERY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter PARSE_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    private DexcomTimestampParser() {
    }

    public static Instant parse(String value) throws GlucoseApiException {
        if (value == null || value.isBlank()) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE, "Missing Dexcom timestamp");
        }
        String text = value.trim();
        TemporalAccessor parsed;
        try {
            parsed = PARSE_FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE, "Unrecognised Dexcom timestamp: " + text, e);
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    public static String formatForQuery(Instant instant) {
        return QUERY_FORMAT.format(instant);
    }
}

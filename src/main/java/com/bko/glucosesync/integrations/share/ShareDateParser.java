package com.bko.glucosesync.integrations.share;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Share dates are {@code Date(1700000000000)}, {@code Date(1700000000000-0500)} or {@code /Date(1700000000000)/}.
 * The optional offset only describes the display zone; the milliseconds are already UTC. ISO-8601 is accepted as a
 * fallback.
 */
public final class ShareDateParser {
    private static final Pattern EPOCH_DATE = Pattern.compile("^/?Date\\((-?\\d+)([+-]\\d{4})?\\)/?$");

    private ShareDateParser() {
    }

    public static Instant parse(String value) throws GlucoseApiException {
        if (value == null || value.isBlank()) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE, "Missing Share date");
        }
        String text = value.trim();
        Matcher matcher = EPOCH_DATE.matcher(text);
        if (matcher.matches()) {
            return Instant.ofEpochMilli(Long.parseLong(matcher.group(1)));
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return parseLocal(text);
        }
    }

    private static Instant parseLocal(String text) throws GlucoseApiException {
        try {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE, "Unrecognised Share date: " + text, e);
        }
    }
}

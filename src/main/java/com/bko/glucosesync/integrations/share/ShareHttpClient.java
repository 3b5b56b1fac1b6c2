package com.bko.glucosesync.integrations.share;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.DataSourceInfo;
import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.glucose.TrendDirection;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.HttpCall;
import com.bko.glucosesync.shared.HttpResult;
import com.bko.glucosesync.shared.HttpTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Component
public class ShareHttpClient implements ShareClientPort {
    private static final Logger logger = LoggerFactory.getLogger(ShareHttpClient.class);
    private static final String READINGS_PATH = "/ShareWebServices/Services/Publisher/ReadPublisherLatestGlucoseValues";
    static final int MIN_COUNT = 1;
    static final int MAX_COUNT = 288;
    static final int MAX_MINUTES = 1440;
    private static final int LATEST_COUNT = 12;
    private static final int LATEST_MINUTES = 60;

    private final ShareSessionAuthenticator authenticator;
    private final HttpTransport transport;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ShareHttpClient(ShareSessionAuthenticator authenticator, HttpTransport transport, Clock clock) {
        this.authenticator = authenticator;
        this.transport = transport;
        this.clock = clock;
    }

    @Override
    public List<GlucoseReading> fetchGlucoseReadings(int maxCount, int minutes) throws IOException {
        int count = Math.max(MIN_COUNT, Math.min(MAX_COUNT, maxCount));
        int window = Math.max(1, Math.min(MAX_MINUTES, minutes));
        List<ShareGlucoseRecord> records = execute(window, count, true);
        List<GlucoseReading> readings = new ArrayList<>();
        for (ShareGlucoseRecord record : records) {
            if (record.getValue() == null) {
                continue;
            }
            readings.add(toReading(record));
        }
        readings.sort(Comparator.comparing(GlucoseReading::timestamp).reversed());
        logger.info("Fetched {} Share readings covering {} minutes", readings.size(), window);
        return readings;
    }

    /**
     * Share only answers "the last N minutes", so the request reaches back from now to {@code start} and the
     * result is trimmed to the window.
     */
    @Override
    public List<GlucoseReading> fetchReadings(Instant start, Instant end) throws IOException {
        if (start.isAfter(end)) {
            throw new GlucoseApiException(ErrorKind.INVALID_DATE_RANGE, "Start " + start + " is after end " + end);
        }
        long minutesBack = Duration.between(start, clock.instant()).toMinutes() + 1;
        int minutes = (int) Math.max(1, Math.min(MAX_MINUTES, minutesBack));
        int maxCount = Math.min(minutes / 5 + 1, MAX_COUNT);

        List<GlucoseReading> readings = new ArrayList<>();
        for (GlucoseReading reading : fetchGlucoseReadings(maxCount, minutes)) {
            if (!reading.timestamp().isBefore(start) && !reading.timestamp().isAfter(end)) {
                readings.add(reading);
            }
        }
        return readings;
    }

    @Override
    public Optional<GlucoseReading> fetchLatestReading() throws IOException {
        try {
            return fetchGlucoseReadings(LATEST_COUNT, LATEST_MINUTES).stream().findFirst();
        } catch (GlucoseApiException e) {
            if (e.isNoData()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public boolean isAvailable() {
        return authenticator.hasCredentials();
    }

    @Override
    public ConnectionStatus connectionStatus() {
        return authenticator.connectionStatus();
    }

    @Override
    public DataSourceInfo sourceInfo() {
        return new DataSourceInfo(
                "Dexcom Share",
                "share",
                Duration.ofMinutes(5),
                "Unofficial real-time API, readings arrive within minutes"
        );
    }

    private List<ShareGlucoseRecord> execute(int minutes, int maxCount, boolean allowRetry) throws IOException {
        String sessionId = authenticator.getSessionId();
        HttpCall call = HttpCall.postJson(readingsUri(sessionId, minutes, maxCount), "")
                .withHeader("Accept", "application/json")
                .withHeader("User-Agent", ShareSessionAuthenticator.USER_AGENT);
        HttpResult result = transport.execute(call);
        int status = result.statusCode();

        if (result.isSuccess()) {
            authenticator.markConnected();
            return decode(result.body());
        }
        if (status == 401 || status == 500) {
            if (allowRetry) {
                logger.info("Share request failed with {}, logging in again and retrying...", status);
                authenticator.clearSession();
                return execute(minutes, maxCount, false);
            }
            if (status == 401) {
                authenticator.markError(ErrorKind.SESSION_EXPIRED.userMessage());
                throw new GlucoseApiException(ErrorKind.SESSION_EXPIRED,
                        "Share API error: HTTP 401 after new login", 401, null);
            }
            throw new GlucoseApiException(ErrorKind.SERVER_ERROR,
                    "Share API error: HTTP 500 after new login", 500, null);
        }
        if (status == 404) {
            throw new GlucoseApiException(ErrorKind.NO_DATA_AVAILABLE, "Share API error: HTTP 404", 404, null);
        }
        if (status == 429) {
            throw new GlucoseApiException(ErrorKind.RATE_LIMIT_EXCEEDED, "Share API error: HTTP 429", 429, null);
        }
        ErrorKind kind = status >= 500 ? ErrorKind.SERVER_ERROR : ErrorKind.HTTP_ERROR;
        logger.error("Share readings request failed: HTTP {}", status);
        throw new GlucoseApiException(kind, "Share API error: HTTP " + status, status, null);
    }

    private List<ShareGlucoseRecord> decode(String body) throws GlucoseApiException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            ShareGlucoseRecord[] records = objectMapper.readValue(body, ShareGlucoseRecord[].class);
            return records != null ? List.of(records) : List.of();
        } catch (JsonProcessingException e) {
            ShareErrorResponse error = readError(body);
            if (error != null && (error.getCode() != null || error.getMessage() != null)) {
                throw new GlucoseApiException(ErrorKind.API_ERROR,
                        "Share API error: " + error.getCode() + " - " + error.getMessage(), e);
            }
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE,
                    "Could not decode Share readings: " + e.getOriginalMessage(), e);
        }
    }

    private ShareErrorResponse readError(String body) {
        try {
            return objectMapper.readValue(body, ShareErrorResponse.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private GlucoseReading toReading(ShareGlucoseRecord record) throws GlucoseApiException {
        String date = record.getWallTime() != null ? record.getWallTime()
                : record.getSystemTime() != null ? record.getSystemTime() : record.getDisplayTime();
        return new GlucoseReading(record.getValue(), ShareDateParser.parse(date),
                TrendDirection.fromUpstream(record.getTrend()), ReadingSource.SHARE, "Dexcom Share");
    }

    private URI readingsUri(String sessionId, int minutes, int maxCount) throws GlucoseApiException {
        try {
            return new URIBuilder(authenticator.baseUrl() + READINGS_PATH)
                    .addParameter("sessionId", sessionId)
                    .addParameter("minutes", String.valueOf(minutes))
                    .addParameter("maxCount", String.valueOf(maxCount))
                    .build();
        } catch (URISyntaxException e) {
            throw new GlucoseApiException(ErrorKind.INVALID_CONFIGURATION, "Failed to build Share URI", e);
        }
    }
}

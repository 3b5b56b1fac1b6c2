package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.DataSourceInfo;
import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.glucose.TrendDirection;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.DexcomSettings;
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
public class DexcomHttpClient implements DexcomClientPort {
    private static final Logger logger = LoggerFactory.getLogger(DexcomHttpClient.class);
    private static final String API = "Dexcom";
    private static final String USER_PATH = "/v3/users/self";
    private static final Duration LATEST_LOOKBACK = Duration.ofHours(24);

    private final DexcomOAuthAuthenticator authenticator;
    private final HttpTransport transport;
    private final DexcomSettings settings;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DexcomHttpClient(DexcomOAuthAuthenticator authenticator,
                            HttpTransport transport,
                            AppSettings settings,
                            Clock clock) {
        this.authenticator = authenticator;
        this.transport = transport;
        this.settings = settings.dexcom();
        this.clock = clock;
    }

    @Override
    public List<GlucoseReading> fetchReadings(Instant start, Instant end) throws IOException {
        validateTimeWindow(start, end);
        DexcomEgvsResponse response = execute(windowUri("/egvs", start, end), DexcomEgvsResponse.class);
        List<GlucoseReading> readings = new ArrayList<>();
        if (response.getRecords() != null) {
            for (DexcomEgvRecord record : response.getRecords()) {
                if (record.getValue() == null) {
                    continue;
                }
                readings.add(toReading(record));
            }
        }
        readings.sort(Comparator.comparing(GlucoseReading::timestamp).reversed());
        logger.info("Fetched {} Dexcom readings between {} and {}", readings.size(), start, end);
        return readings;
    }

    @Override
    public Optional<GlucoseReading> fetchLatestReading() throws IOException {
        Instant end = clock.instant().minus(settings.dataDelay());
        try {
            List<GlucoseReading> readings = fetchReadings(end.minus(LATEST_LOOKBACK), end);
            return readings.stream().findFirst();
        } catch (GlucoseApiException e) {
            if (e.isNoData()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<DexcomDevice> fetchDevices() throws IOException {
        DexcomDevicesResponse response = execute(uri("/devices"), DexcomDevicesResponse.class);
        logger.info("Fetched {} Dexcom devices", response.getRecords().size());
        return response.getRecords();
    }

    @Override
    public List<DexcomEvent> fetchEvents(Instant start, Instant end) throws IOException {
        validateTimeWindow(start, end);
        DexcomEventsResponse response = execute(windowUri("/events", start, end), DexcomEventsResponse.class);
        logger.info("Fetched {} Dexcom user events", response.getRecords().size());
        return response.getRecords();
    }

    @Override
    public DexcomDataRange fetchDataRange() throws IOException {
        return execute(uri("/dataRange"), DexcomDataRange.class);
    }

    @Override
    public DexcomStatistics fetchStatistics(Instant start, Instant end) throws IOException {
        validateTimeWindow(start, end);
        DexcomStatistics statistics = execute(windowUri("/statistics", start, end), DexcomStatistics.class);
        logger.info("Fetched Dexcom statistics: mean={}, stdDev={}", statistics.getMean(), statistics.getStdDev());
        return statistics;
    }

    @Override
    public boolean isAvailable() {
        return authenticator.hasStoredToken();
    }

    @Override
    public ConnectionStatus connectionStatus() {
        return authenticator.connectionStatus();
    }

    @Override
    public DataSourceInfo sourceInfo() {
        return new DataSourceInfo(
                "Dexcom Official API",
                "official",
                settings.dataDelay(),
                "Regulated API, readings become available " + settings.dataDelay().toHours() + " hours late"
        );
    }

    void validateTimeWindow(Instant start, Instant end) throws GlucoseApiException {
        if (start.isAfter(end)) {
            throw new GlucoseApiException(ErrorKind.INVALID_DATE_RANGE, "Start " + start + " is after end " + end);
        }
        if (Duration.between(start, end).compareTo(settings.maxWindow()) > 0) {
            throw new GlucoseApiException(ErrorKind.TIME_WINDOW_TOO_LARGE,
                    "Dexcom windows are limited to " + settings.maxWindow().toDays() + " days");
        }
        Instant mostRecentAvailable = clock.instant().minus(settings.dataDelay());
        if (end.isAfter(mostRecentAvailable)) {
            throw new GlucoseApiException(ErrorKind.DATA_DELAY_NOT_MET,
                    "Dexcom data after " + mostRecentAvailable + " is not available yet");
        }
    }

    private GlucoseReading toReading(DexcomEgvRecord record) throws GlucoseApiException {
        String time = record.getSystemTime() != null ? record.getSystemTime() : record.getDisplayTime();
        Instant timestamp = DexcomTimestampParser.parse(time);
        String device = record.getDisplayDevice() != null ? record.getDisplayDevice() : "Dexcom";
        return new GlucoseReading(record.getValue(), timestamp, TrendDirection.fromUpstream(record.getTrend()),
                ReadingSource.OFFICIAL, device);
    }

    private <T> T execute(URI uri, Class<T> type) throws IOException {
        return execute(uri, type, true);
    }

    private <T> T execute(URI uri, Class<T> type, boolean allowRetry) throws IOException {
        String accessToken = authenticator.getAccessToken();
        HttpCall call = HttpCall.get(uri)
                .withHeader("Authorization", "Bearer " + accessToken)
                .withHeader("Accept", "application/json");
        HttpResult result = transport.execute(call);
        int status = result.statusCode();

        if (result.isSuccess()) {
            authenticator.markConnected();
            return decode(result.body(), type);
        }
        if (status == 401) {
            if (allowRetry) {
                logger.info("Request to {} failed with 401, refreshing token and retrying...", uri.getPath());
                authenticator.invalidateAccessToken(accessToken);
                return execute(uri, type, false);
            }
            authenticator.markError(ErrorKind.TOKEN_EXPIRED.userMessage());
            throw new GlucoseApiException(ErrorKind.TOKEN_EXPIRED,
                    "Dexcom API error: HTTP 401 after token refresh", 401, null);
        }
        if (status == 429) {
            throw new GlucoseApiException(ErrorKind.RATE_LIMIT_EXCEEDED, "Dexcom API error: HTTP 429", 429, null);
        }
        if (status == 404) {
            throw new GlucoseApiException(ErrorKind.NO_DATA_AVAILABLE, "Dexcom API error: HTTP 404", 404, null);
        }
        GlucoseApiException error = GlucoseApiException.fromHttpStatus(API, status, result.body());
        logger.error("Error executing request to {}: {}", uri.getPath(), error.getMessage());
        if (error.requiresReauthentication()) {
            authenticator.markError(error.userMessage());
        }
        throw error;
    }

    private <T> T decode(String body, Class<T> type) throws GlucoseApiException {
        if (body == null || body.isBlank()) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Empty Dexcom response");
        }
        T value;
        try {
            value = objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE,
                    "Could not decode Dexcom " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Empty Dexcom response");
        }
        return value;
    }

    private URI uri(String path) {
        return URI.create(settings.baseUrl() + USER_PATH + path);
    }

    private URI windowUri(String path, Instant start, Instant end) throws GlucoseApiException {
        try {
            return new URIBuilder(settings.baseUrl() + USER_PATH + path)
                    .addParameter("startDate", DexcomTimestampParser.formatForQuery(start))
                    .addParameter("endDate", DexcomTimestampParser.formatForQuery(end))
                    .build();
        } catch (URISyntaxException e) {
            throw new GlucoseApiException(ErrorKind.INVALID_CONFIGURATION, "Failed to build Dexcom URI", e);
        }
    }
}

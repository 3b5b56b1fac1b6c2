package com.bko.glucosesync.integrations.share;

import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.glucose.TrendDirection;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.HttpCall;
import com.bko.glucosesync.shared.HttpResult;
import com.bko.glucosesync.shared.HttpTransport;
import com.bko.glucosesync.shared.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShareHttpClientTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ShareSessionAuthenticator authenticator;
    private HttpTransport transport;
    private ShareHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        authenticator = mock(ShareSessionAuthenticator.class);
        transport = mock(HttpTransport.class);
        when(authenticator.getSessionId()).thenReturn("session-1", "session-2");
        when(authenticator.baseUrl()).thenReturn("https://share2.dexcom.com");
        client = new ShareHttpClient(authenticator, transport, new MutableClock(NOW));
    }

    @Test
    void parsesReadingsNewestFirst() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(200, "["
                + "{\"WT\":\"Date(" + NOW.minusSeconds(600).toEpochMilli() + ")\",\"Value\":120,\"Trend\":\"Flat\"},"
                + "{\"WT\":\"Date(" + NOW.minusSeconds(300).toEpochMilli() + ")\",\"Value\":126,\"Trend\":3}"
                + "]"));

        List<GlucoseReading> readings = client.fetchGlucoseReadings(2, 30);

        assertEquals(2, readings.size());
        assertEquals(126, readings.get(0).value());
        assertEquals(TrendDirection.FORTY_FIVE_UP, readings.get(0).trend());
        assertEquals(TrendDirection.FLAT, readings.get(1).trend());
        assertEquals(ReadingSource.SHARE, readings.get(1).source());
        assertEquals("Dexcom Share", readings.get(1).deviceLabel());

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).execute(captor.capture());
        String query = captor.getValue().uri().getQuery();
        assertTrue(query.contains("sessionId=session-1"));
        assertTrue(query.contains("minutes=30"));
        assertTrue(query.contains("maxCount=2"));
    }

    @Test
    void argumentsAreClamped() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(200, "[]"));

        client.fetchGlucoseReadings(1000, 5000);

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).execute(captor.capture());
        String query = captor.getValue().uri().getQuery();
        assertTrue(query.contains("minutes=1440"));
        assertTrue(query.contains("maxCount=288"));
    }

    @Test
    void emptyBodyMeansNoReadings() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(200, ""));

        assertTrue(client.fetchGlucoseReadings(10, 60).isEmpty());
    }

    @Test
    void rangeFetchCountsMinutesBackFromNowAndTrimsToWindow() throws Exception {
        Instant start = NOW.minus(Duration.ofMinutes(60));
        Instant end = NOW.minus(Duration.ofMinutes(30));
        when(transport.execute(any())).thenReturn(new HttpResult(200, "["
                + "{\"WT\":\"Date(" + NOW.minusSeconds(600).toEpochMilli() + ")\",\"Value\":120},"
                + "{\"WT\":\"Date(" + NOW.minusSeconds(2400).toEpochMilli() + ")\",\"Value\":110}"
                + "]"));

        List<GlucoseReading> readings = client.fetchReadings(start, end);

        assertEquals(1, readings.size());
        assertEquals(110, readings.get(0).value());
        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).execute(captor.capture());
        assertTrue(captor.getValue().uri().getQuery().contains("minutes=61"));
        assertTrue(captor.getValue().uri().getQuery().contains("maxCount=13"));
    }

    @Test
    void serverErrorLogsInAgainAndRetriesOnce() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(500, ""), new HttpResult(200, "[]"));

        assertTrue(client.fetchGlucoseReadings(10, 60).isEmpty());

        verify(authenticator).clearSession();
        verify(transport, times(2)).execute(any());
    }

    @Test
    void secondUnauthorizedIsSessionExpired() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(401, ""));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> client.fetchGlucoseReadings(10, 60));

        assertEquals(ErrorKind.SESSION_EXPIRED, e.getKind());
        assertTrue(e.requiresReauthentication());
        verify(transport, times(2)).execute(any());
    }

    @Test
    void errorObjectInBodyIsApiError() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(200,
                "{\"Code\":\"SessionIdNotFound\",\"Message\":\"Session not active or timed out\"}"));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> client.fetchGlucoseReadings(10, 60));
        assertEquals(ErrorKind.API_ERROR, e.getKind());
    }

    @Test
    void rateLimitIsReportedWithoutRetry() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(429, ""));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> client.fetchGlucoseReadings(10, 60));

        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, e.getKind());
        assertTrue(e.isRetryable());
        verify(transport, times(1)).execute(any());
        verify(authenticator, never()).clearSession();
    }

    @Test
    void notFoundIsNoData() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(404, ""));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> client.fetchGlucoseReadings(10, 60));
        assertEquals(ErrorKind.NO_DATA_AVAILABLE, e.getKind());
        assertTrue(client.fetchLatestReading().isEmpty());
    }
}

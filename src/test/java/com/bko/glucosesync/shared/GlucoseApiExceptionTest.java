package com.bko.glucosesync.shared;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlucoseApiExceptionTest {

    @Test
    void mapsStatusCodesToKinds() {
        assertEquals(ErrorKind.TOKEN_EXPIRED, GlucoseApiException.fromHttpStatus("Dexcom", 401, null).getKind());
        assertEquals(ErrorKind.AUTHORIZATION_FAILED, GlucoseApiException.fromHttpStatus("Dexcom", 403, "").getKind());
        assertEquals(ErrorKind.NO_DATA_AVAILABLE, GlucoseApiException.fromHttpStatus("Dexcom", 404, null).getKind());
        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, GlucoseApiException.fromHttpStatus("Dexcom", 429, null).getKind());
        assertEquals(ErrorKind.SERVER_ERROR, GlucoseApiException.fromHttpStatus("Dexcom", 503, "oops").getKind());
        assertEquals(ErrorKind.HTTP_ERROR, GlucoseApiException.fromHttpStatus("Dexcom", 418, null).getKind());
    }

    @Test
    void errorBodyWinsOverStatus() {
        GlucoseApiException e = GlucoseApiException.fromHttpStatus("Dexcom", 400,
                "{\"code\":\"InvalidArgument\",\"message\":\"startDate is required\"}");

        assertEquals(ErrorKind.API_ERROR, e.getKind());
        assertEquals(400, e.getStatusCode());
        assertTrue(e.getMessage().contains("startDate is required"));
    }

    @Test
    void statusMessageNamesApi() {
        GlucoseApiException e = GlucoseApiException.fromHttpStatus("Share", 500, null);
        assertEquals("Share API error: HTTP 500", e.getMessage());
    }

    @Test
    void kindPropertiesDriveRecovery() {
        assertTrue(ErrorKind.TOKEN_REFRESH_FAILED.requiresReauthentication());
        assertTrue(ErrorKind.SESSION_EXPIRED.requiresReauthentication());
        assertFalse(ErrorKind.SERVER_ERROR.requiresReauthentication());

        assertTrue(ErrorKind.RATE_LIMIT_EXCEEDED.isRetryable());
        assertFalse(ErrorKind.INVALID_CREDENTIALS.isRetryable());
        assertEquals(Duration.ofSeconds(60), ErrorKind.RATE_LIMIT_EXCEEDED.retryDelay());
        assertEquals(Duration.ZERO, ErrorKind.TIME_WINDOW_TOO_LARGE.retryDelay());
        assertEquals(ErrorKind.Category.VALIDATION, ErrorKind.INVALID_DATE_RANGE.category());
    }
}

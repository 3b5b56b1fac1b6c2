package com.bko.glucosesync.shared;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Failure raised by the glucose upstreams and the reading store. The {@link ErrorKind} decides how callers react;
 * the message is for logs only.
 */
public class GlucoseApiException extends IOException {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ErrorKind kind;
    private final Integer statusCode;

    public GlucoseApiException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public GlucoseApiException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public GlucoseApiException(ErrorKind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    /**
     * Maps a non-success response. An {@code {code, message}} error body wins over the status code.
     */
    public static GlucoseApiException fromHttpStatus(String api, int status, String body) {
        String apiMessage = readApiErrorMessage(body);
        if (apiMessage != null) {
            return new GlucoseApiException(ErrorKind.API_ERROR, api + " API error: " + apiMessage, status, null);
        }
        ErrorKind kind;
        if (status == 401) {
            kind = ErrorKind.TOKEN_EXPIRED;
        } else if (status == 403) {
            kind = ErrorKind.AUTHORIZATION_FAILED;
        } else if (status == 404) {
            kind = ErrorKind.NO_DATA_AVAILABLE;
        } else if (status == 429) {
            kind = ErrorKind.RATE_LIMIT_EXCEEDED;
        } else if (status >= 500 && status < 600) {
            kind = ErrorKind.SERVER_ERROR;
        } else {
            kind = ErrorKind.HTTP_ERROR;
        }
        return new GlucoseApiException(kind, api + " API error: HTTP " + status, status, null);
    }

    private static String readApiErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isObject() && node.hasNonNull("code") && node.hasNonNull("message")) {
                return node.get("code").asText() + " - " + node.get("message").asText();
            }
        } catch (IOException e) {
            return null;
        }
        return null;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean requiresReauthentication() {
        return kind.requiresReauthentication();
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public boolean isNoData() {
        return kind == ErrorKind.NO_DATA_AVAILABLE;
    }

    public String userMessage() {
        return kind.userMessage();
    }
}

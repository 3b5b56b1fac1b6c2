package com.bko.glucosesync.shared;

import java.time.Duration;

public enum ErrorKind {
    AUTHORIZATION_CANCELLED(Category.AUTHENTICATION, "Authorization was cancelled."),
    AUTHORIZATION_FAILED(Category.AUTHENTICATION, "Authorization failed. Please connect again."),
    INVALID_AUTHORIZATION_CODE(Category.AUTHENTICATION, "The authorization code was not accepted."),
    TOKEN_REFRESH_FAILED(Category.AUTHENTICATION, "Could not renew access. Please connect again."),
    TOKEN_EXPIRED(Category.AUTHENTICATION, "Access has expired. Please connect again."),
    SESSION_EXPIRED(Category.AUTHENTICATION, "The Share session has expired. Please sign in again."),
    INVALID_CREDENTIALS(Category.AUTHENTICATION, "Username or password is incorrect."),

    TRANSPORT_FAILURE(Category.NETWORK, "Network connection failed."),
    INVALID_RESPONSE(Category.NETWORK, "The server sent an unexpected response."),
    DECODE_FAILURE(Category.NETWORK, "The server response could not be read."),
    CANCELLED(Category.NETWORK, "The request was cancelled."),

    RATE_LIMIT_EXCEEDED(Category.UPSTREAM, "Too many requests. Please wait before trying again."),
    SERVER_ERROR(Category.UPSTREAM, "The glucose service is temporarily unavailable."),
    HTTP_ERROR(Category.UPSTREAM, "The glucose service returned an error."),
    API_ERROR(Category.UPSTREAM, "The glucose service rejected the request."),
    NO_DATA_AVAILABLE(Category.UPSTREAM, "No glucose data is available for this period."),
    DATA_DELAY_NOT_MET(Category.UPSTREAM, "Data for this period is not available yet."),

    TIME_WINDOW_TOO_LARGE(Category.VALIDATION, "The requested time window is too large."),
    INVALID_DATE_RANGE(Category.VALIDATION, "The requested date range is invalid."),

    NOT_CONNECTED(Category.CONNECTION, "Not connected."),
    CONNECTION_LOST(Category.CONNECTION, "The connection was lost."),
    INVALID_CONFIGURATION(Category.CONNECTION, "The integration is not configured."),

    STORAGE_FAILURE(Category.STORAGE, "Glucose readings could not be stored.");

    public enum Category {
        AUTHENTICATION,
        NETWORK,
        UPSTREAM,
        VALIDATION,
        CONNECTION,
        STORAGE
    }

    private final Category category;
    private final String userMessage;

    ErrorKind(Category category, String userMessage) {
        this.category = category;
        this.userMessage = userMessage;
    }

    public Category category() {
        return category;
    }

    public String userMessage() {
        return userMessage;
    }

    /**
     * Stored credentials are no longer usable. These are never retried automatically.
     */
    public boolean requiresReauthentication() {
        switch (this) {
            case AUTHORIZATION_FAILED:
            case TOKEN_REFRESH_FAILED:
            case TOKEN_EXPIRED:
            case SESSION_EXPIRED:
            case INVALID_CREDENTIALS:
            case NOT_CONNECTED:
                return true;
            default:
                return false;
        }
    }

    public boolean isRetryable() {
        switch (this) {
            case TRANSPORT_FAILURE:
            case INVALID_RESPONSE:
            case RATE_LIMIT_EXCEEDED:
            case SERVER_ERROR:
            case CONNECTION_LOST:
                return true;
            default:
                return false;
        }
    }

    public Duration retryDelay() {
        switch (this) {
            case RATE_LIMIT_EXCEEDED:
                return Duration.ofSeconds(60);
            case SERVER_ERROR:
                return Duration.ofSeconds(30);
            case TRANSPORT_FAILURE:
            case CONNECTION_LOST:
            case INVALID_RESPONSE:
                return Duration.ofSeconds(5);
            default:
                return Duration.ZERO;
        }
    }
}

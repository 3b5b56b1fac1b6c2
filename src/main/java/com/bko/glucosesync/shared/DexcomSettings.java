package com.bko.glucosesync.shared;

import java.time.Duration;

public record DexcomSettings(
        String clientId,
        String clientSecret,
        String redirectUri,
        String environment,
        Duration dataDelay,
        Duration safetyBuffer,
        Duration maxWindow
) {
    public static final Duration DEFAULT_DATA_DELAY = Duration.ofHours(3);
    public static final Duration DEFAULT_SAFETY_BUFFER = Duration.ofMinutes(15);
    public static final Duration DEFAULT_MAX_WINDOW = Duration.ofDays(30);

    public DexcomSettings(String clientId, String clientSecret, String redirectUri, String environment) {
        this(clientId, clientSecret, redirectUri, environment,
                DEFAULT_DATA_DELAY, DEFAULT_SAFETY_BUFFER, DEFAULT_MAX_WINDOW);
    }

    public boolean isConfigured() {
        return hasText(clientId) && hasText(clientSecret) && hasText(redirectUri);
    }

    public String baseUrl() {
        if (environment == null) {
            return "https://api.dexcom.eu";
        }
        switch (environment.toLowerCase()) {
            case "sandbox":
                return "https://sandbox-api.dexcom.com";
            case "us":
                return "https://api.dexcom.com";
            default:
                return "https://api.dexcom.eu";
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

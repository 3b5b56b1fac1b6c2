package com.bko.glucosesync.shared;

import java.time.Duration;

public record ShareSettings(
        String username,
        String password,
        String server,
        String applicationId,
        Duration sessionLifetime
) {
    public static final String DEFAULT_APPLICATION_ID = "d8665ade-9673-4e27-9ff6-92db4ce13d13";
    public static final Duration DEFAULT_SESSION_LIFETIME = Duration.ofHours(24);

    public ShareSettings(String username, String password, String server) {
        this(username, password, server, DEFAULT_APPLICATION_ID, DEFAULT_SESSION_LIFETIME);
    }

    public boolean hasCredentials() {
        return hasText(username) && hasText(password);
    }

    public String baseUrl() {
        if (server != null && server.equalsIgnoreCase("international")) {
            return "https://shareous1.dexcom.com";
        }
        return "https://share2.dexcom.com";
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

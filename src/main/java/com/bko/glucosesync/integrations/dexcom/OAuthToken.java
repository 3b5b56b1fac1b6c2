package com.bko.glucosesync.integrations.dexcom;

import java.time.Duration;
import java.time.Instant;

public record OAuthToken(String accessToken, String refreshToken, Instant expiry) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiry);
    }

    public boolean expiresWithin(Duration margin, Instant now) {
        return !now.plus(margin).isBefore(expiry);
    }

    OAuthToken expired() {
        return new OAuthToken(accessToken, refreshToken, Instant.EPOCH);
    }
}

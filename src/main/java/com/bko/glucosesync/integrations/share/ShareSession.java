package com.bko.glucosesync.integrations.share;

import java.time.Instant;

public record ShareSession(String sessionId, Instant expiry) {
    public boolean isValid(Instant now) {
        return now.isBefore(expiry);
    }
}

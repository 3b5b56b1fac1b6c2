package com.bko.glucosesync.sync;

import java.time.Instant;

public record GlucoseDataUpdatedEvent(Instant syncedAt, int officialSaved, int shareSaved) {
    public int totalSaved() {
        return officialSaved + shareSaved;
    }
}

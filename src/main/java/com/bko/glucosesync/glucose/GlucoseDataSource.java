package com.bko.glucosesync.glucose;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface GlucoseDataSource {
    List<GlucoseReading> fetchReadings(Instant start, Instant end) throws IOException;

    Optional<GlucoseReading> fetchLatestReading() throws IOException;

    boolean isAvailable();

    DataSourceInfo sourceInfo();
}

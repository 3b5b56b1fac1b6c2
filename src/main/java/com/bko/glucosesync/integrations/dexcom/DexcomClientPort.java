package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.GlucoseDataSource;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface DexcomClientPort extends GlucoseDataSource {
    List<DexcomDevice> fetchDevices() throws IOException;
    List<DexcomEvent> fetchEvents(Instant start, Instant end) throws IOException;
    DexcomDataRange fetchDataRange() throws IOException;
    DexcomStatistics fetchStatistics(Instant start, Instant end) throws IOException;
    ConnectionStatus connectionStatus();
}

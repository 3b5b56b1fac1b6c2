package com.bko.glucosesync.integrations.share;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.GlucoseDataSource;
import com.bko.glucosesync.glucose.GlucoseReading;

import java.io.IOException;
import java.util.List;

public interface ShareClientPort extends GlucoseDataSource {
    List<GlucoseReading> fetchGlucoseReadings(int maxCount, int minutes) throws IOException;
    ConnectionStatus connectionStatus();
}

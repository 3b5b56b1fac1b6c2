package com.bko.glucosesync.glucose;

import java.time.Duration;

public record DataSourceInfo(String name, String type, Duration typicalDelay, String description) {
}
